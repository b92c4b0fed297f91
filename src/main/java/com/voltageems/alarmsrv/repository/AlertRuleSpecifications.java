package com.voltageems.alarmsrv.repository;

import com.voltageems.alarmsrv.model.RuleFilter;
import jakarta.persistence.criteria.Predicate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.data.jpa.domain.Specification;

final class AlertRuleSpecifications {

  private static final char LIKE_ESCAPE = '\\';

  private AlertRuleSpecifications() {}

  static Specification<AlertRuleEntity> matching(RuleFilter filter) {
    return (root, query, cb) -> {
      List<Predicate> predicates = new ArrayList<>();

      if (filter.keyword() != null && !filter.keyword().isBlank()) {
        String pattern = "%" + escapeLike(filter.keyword().trim().toLowerCase()) + "%";
        predicates.add(cb.or(
            cb.like(cb.lower(root.get("ruleName")), pattern, LIKE_ESCAPE),
            cb.like(cb.lower(root.get("description")), pattern, LIKE_ESCAPE),
            cb.like(root.get("channelId").as(String.class), pattern, LIKE_ESCAPE),
            cb.like(root.get("pointId").as(String.class), pattern, LIKE_ESCAPE)
        ));
      }
      if (filter.warningLevel() != null) {
        predicates.add(cb.equal(root.get("warningLevel"), filter.warningLevel()));
      }
      if (filter.enabled() != null) {
        predicates.add(cb.equal(root.get("enabled"), filter.enabled()));
      }
      if (filter.createdFrom() != null) {
        predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("createdAt"), filter.createdFrom()));
      }
      if (filter.createdTo() != null) {
        predicates.add(cb.lessThanOrEqualTo(root.<Instant>get("createdAt"), filter.createdTo()));
      }
      return cb.and(predicates.toArray(new Predicate[0]));
    };
  }

  static String escapeLike(String raw) {
    StringBuilder escaped = new StringBuilder(raw.length());
    for (char c : raw.toCharArray()) {
      if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
        escaped.append(LIKE_ESCAPE);
      }
      escaped.append(c);
    }
    return escaped.toString();
  }
}
