package com.apogee.repository;

import com.apogee.entity.Claim;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ClaimRepository extends JpaRepository<Claim, UUID> {

    List<Claim> findByVideoIdOrderByCreatedAtAsc(UUID videoId);
}
