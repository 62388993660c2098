package com.meisai.ingest.repository;

import com.meisai.ingest.entity.ImportSession;
import com.meisai.ingest.entity.ImportStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;

public interface ImportSessionRepository extends JpaRepository<ImportSession, String>,
        JpaSpecificationExecutor<ImportSession> {

    List<ImportSession> findByStatusIn(List<ImportStatus> statuses);
}
