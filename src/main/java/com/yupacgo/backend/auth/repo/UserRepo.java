package com.yupacgo.backend.auth.repo;

import com.yupacgo.backend.auth.entity.Role;
import com.yupacgo.backend.auth.entity.User;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface UserRepo extends JpaRepository<User, Long> {

    Optional<User> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    Page<User> findByRole(Role role, Pageable pageable);

    @Modifying
    @Query("update User u set u.passwordHash = :hash, u.updatedAt = :now where u.id = :id")
    int updatePasswordHash(@Param("id") Long id, @Param("hash") String hash, @Param("now") Instant now);
}
