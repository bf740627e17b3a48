package com.example.cdnmonitor.repository;

import com.example.cdnmonitor.model.entity.Alert;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface AlertRepository extends JpaRepository<Alert, Long> {

    Optional<Alert> findFirstByServer_IdAndAlertTypeAndAcknowledgedFalse(Long serverId, Alert.Type alertType);

    long countByServer_IdAndAlertTypeAndAcknowledgedFalse(Long serverId, Alert.Type alertType);

    long countByServer_Id(Long serverId);

    @Query("""
        select a
        from Alert a
        join fetch a.server
        where a.acknowledged = false
        order by a.createdAt desc, a.id desc
    """)
    List<Alert> findOpenWithServer(Pageable pageable);

    @Modifying
    @Query("delete from Alert a where a.server.id = :serverId")
    int deleteByServerId(@Param("serverId") Long serverId);
}
