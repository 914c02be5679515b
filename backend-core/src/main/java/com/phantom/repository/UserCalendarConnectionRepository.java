package com.phantom.repository;

import com.phantom.domain.model.User;
import com.phantom.domain.model.UserCalendarConnection;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface UserCalendarConnectionRepository extends JpaRepository<UserCalendarConnection, UUID> {
    Optional<UserCalendarConnection> findByUser(User user);
}
