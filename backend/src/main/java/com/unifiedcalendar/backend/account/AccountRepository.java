package com.unifiedcalendar.backend.account;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AccountRepository extends JpaRepository<Account, String> {

    Optional<Account> findFirstByEmailIgnoreCase(String email);

    // Configured scan order
    List<Account> findAllByOrderByCreatedAtAsc();
}
