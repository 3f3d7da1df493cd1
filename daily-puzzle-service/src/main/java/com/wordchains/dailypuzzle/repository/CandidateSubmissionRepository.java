package com.wordchains.dailypuzzle.repository;

import com.wordchains.dailypuzzle.entity.CandidateSubmission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CandidateSubmissionRepository extends JpaRepository<CandidateSubmission, Long> {

    List<CandidateSubmission> findByStatusOrderByIdAsc(String status);
}
