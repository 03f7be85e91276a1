package com.hindsight.setforget.repository;

import com.hindsight.setforget.model.OptimalSquadMember;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface OptimalSquadMemberRepository extends JpaRepository<OptimalSquadMember, Long> {
    List<OptimalSquadMember> findByJobIdOrderByIdAsc(String jobId);
    Optional<OptimalSquadMember> findFirstBySeasonOrderByCreatedAtDescIdDesc(String season);
    long deleteByJobId(String jobId);
}
