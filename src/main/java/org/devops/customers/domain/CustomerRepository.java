package org.devops.customers.domain;

import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for Customer entities. Each finder matches a single column exactly.
 */
@Repository
public interface CustomerRepository extends JpaRepository<CustomerEntity, Long> {

  List<CustomerEntity> findByNameOrderByIdAsc(String name);

  List<CustomerEntity> findByAddressOrderByIdAsc(String address);

  List<CustomerEntity> findByEmailOrderByIdAsc(String email);

  List<CustomerEntity> findByPhoneNumberOrderByIdAsc(String phoneNumber);

  List<CustomerEntity> findByMemberSinceOrderByIdAsc(LocalDate memberSince);

  List<CustomerEntity> findByStatusOrderByIdAsc(String status);
}
