package com.example.cdnmonitor.repository;

import com.example.cdnmonitor.model.entity.ServerMetric;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ServerMetricRepository extends JpaRepository<ServerMetric, Long> {

    Optional<ServerMetric> findFirstByServer_IdOrderByTimestampDesc(Long serverId);

    long countByServer_Id(Long serverId);

    @Query("""
        select m
        from ServerMetric m
        where m.server.id = :serverId
          and m.timestamp >= :since
          and m.timestamp <= :until
        order by m.timestamp desc
    """)
    List<ServerMetric> findWindow(@Param("serverId") Long serverId,
                                  @Param("since") Instant since,
                                  @Param("until") Instant until,
                                  Pageable pageable);

    @Modifying
    @Query("delete from ServerMetric m where m.server.id = :serverId")
    int deleteByServerId(@Param("serverId") Long serverId);
}
