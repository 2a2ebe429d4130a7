package io.b2mash.b2b.mediaflow.folder;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FolderRecordRepository extends JpaRepository<FolderRecord, UUID> {

  List<FolderRecord> findByJobIdOrderByCreatedAtAsc(UUID jobId);
}
