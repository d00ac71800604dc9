package uk.gegc.examinsight.features.exam.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.examinsight.features.exam.domain.model.Exam;

import java.util.UUID;

@Repository
public interface ExamRepository extends JpaRepository<Exam, UUID> {

    Page<Exam> findByUserIdAndActiveTrue(UUID userId, Pageable pageable);
}
