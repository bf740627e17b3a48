package com.example.cdnmonitor.repository;

import com.example.cdnmonitor.model.entity.Server;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ServerRepository extends JpaRepository<Server, Long> {

    boolean existsByHostname(String hostname);

    List<Server> findAllByOrderByHostnameAsc();

    boolean existsByHostnameAndIdNot(String hostname, Long id);

    @Query("select s.status from Server s where s.id = :id")
    Optional<Server.Status> findStatusById(@Param("id") Long id);

    @Modifying
    @Query("update Server s set s.status = :status, s.updatedAt = :now where s.id = :id")
    int updateStatus(@Param("id") Long id, @Param("status") Server.Status status, @Param("now") Instant now);
}
