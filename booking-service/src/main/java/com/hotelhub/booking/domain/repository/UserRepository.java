package com.hotelhub.booking.domain.repository;

import com.hotelhub.booking.domain.model.User;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserRepository extends JpaRepository<User, Long> {
}
