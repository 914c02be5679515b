package com.phantom.repository;

import com.phantom.domain.enums.SchedulingAction;
import com.phantom.domain.model.SchedulingLog;
import com.phantom.domain.model.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface SchedulingLogRepository extends JpaRepository<SchedulingLog, UUID> {
    long countByUserAndAction(User user, SchedulingAction action);
}
