package io.b2mash.b2b.mediaflow.upload;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EditorUploadRepository extends JpaRepository<EditorUpload, UUID> {

  List<EditorUpload> findAllByOrderByUploadedAtAsc();

  List<EditorUpload> findByJobIdOrderByUploadedAtAsc(UUID jobId);

  List<EditorUpload> findByOrderIdOrderByUploadedAtAsc(UUID orderId);
}
