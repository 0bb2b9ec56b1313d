package dev.lecturelens.citation;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link CitationEntity} rows. */
public interface CitationRepository extends JpaRepository<CitationEntity, UUID> {

  List<CitationEntity> findBySessionIdOrderByWindowIndexAscRankAsc(String sessionId);
}
