package com.flagship.tip_ledger.tipout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TipOutRuleRepository extends JpaRepository<TipOutRuleEntity, UUID> {

    List<TipOutRuleEntity> findByLocationIdAndFromRoleAndActiveTrueOrderByCreatedAtAscIdAsc(UUID locationId,
                                                                                            String fromRole);

    List<TipOutRuleEntity> findByLocationIdOrderByFromRoleAscToRoleAsc(UUID locationId);
}
