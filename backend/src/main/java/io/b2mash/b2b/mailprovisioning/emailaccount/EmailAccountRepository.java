package io.b2mash.b2b.mailprovisioning.emailaccount;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EmailAccountRepository extends JpaRepository<EmailAccount, UUID> {

  boolean existsByEmailAddress(String emailAddress);

  List<EmailAccount> findByCustomerIdOrderByCreatedAtAsc(UUID customerId);

  List<EmailAccount> findByMembershipIdOrderByCreatedAtAsc(UUID membershipId);

  List<EmailAccount> findBySiteIdOrderByCreatedAtAsc(UUID siteId);

  long countByCustomerIdAndStatusIn(UUID customerId, Collection<EmailAccountStatus> statuses);

  long countByCustomerIdAndMembershipIdAndStatusIn(
      UUID customerId, UUID membershipId, Collection<EmailAccountStatus> statuses);
}
