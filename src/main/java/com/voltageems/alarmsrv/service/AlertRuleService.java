package com.voltageems.alarmsrv.service;

import com.voltageems.alarmsrv.enums.DataType;
import com.voltageems.alarmsrv.enums.WarningLevel;
import com.voltageems.alarmsrv.exception.DuplicateRuleException;
import com.voltageems.alarmsrv.exception.RuleConstraintException;
import com.voltageems.alarmsrv.model.AlertRuleDto;
import com.voltageems.alarmsrv.model.AlertRuleFields;
import com.voltageems.alarmsrv.model.AlertRuleRequest;
import com.voltageems.alarmsrv.model.RuleFilter;
import com.voltageems.alarmsrv.model.RulePage;
import com.voltageems.alarmsrv.model.RuleSearchCriteria;
import com.voltageems.alarmsrv.model.RuleStats;
import com.voltageems.alarmsrv.repository.AlertRuleEntity;
import com.voltageems.alarmsrv.repository.AlertRuleStore;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

@Service
public class AlertRuleService {

  private static final Logger log = LoggerFactory.getLogger(AlertRuleService.class);

  private final AlertRuleStore store;
  private final RuleValidator validator;

  public AlertRuleService(AlertRuleStore store, RuleValidator validator) {
    this.store = store;
    this.validator = validator;
  }

  public AlertRuleDto createRule(AlertRuleRequest request) {
    AlertRuleFields fields = validator.validate(request);
    AlertRuleEntity saved = rejectingDuplicates(fields, () -> store.insert(fields));
    log.info("Created alarm rule: id={}, channelId={}, dataType={}, pointId={}, ruleName={}",
        saved.getId(), fields.channelId(), fields.dataType().code(), fields.pointId(), fields.ruleName());
    return toDto(saved);
  }

  public AlertRuleDto getRule(long ruleId) {
    return toDto(store.get(ruleId));
  }

  public List<AlertRuleDto> listRules() {
    return toDtos(store.list(null));
  }

  public List<AlertRuleDto> listRulesByChannel(long channelId) {
    return toDtos(store.list(channelId));
  }

  public List<AlertRuleDto> listEnabledRules() {
    return toDtos(store.listEnabled());
  }

  public List<AlertRuleDto> listEnabledRulesForPoint(Long channelId, String dataType, Long pointId) {
    long channel = validator.requirePositive("channelId", channelId);
    DataType type = validator.requireDataType(dataType);
    long point = validator.requirePositive("pointId", pointId);
    return toDtos(store.listEnabledForPoint(channel, type, point));
  }

  public AlertRuleDto updateRule(long ruleId, AlertRuleRequest request) {
    AlertRuleFields fields = validator.validate(request);
    AlertRuleEntity updated = rejectingDuplicates(fields, () -> store.update(ruleId, fields));
    log.info("Updated alarm rule: id={}, ruleName={}", ruleId, fields.ruleName());
    return toDto(updated);
  }

  public void deleteRule(long ruleId) {
    store.delete(ruleId);
    log.info("Deleted alarm rule: id={}", ruleId);
  }

  public AlertRuleDto enableRule(long ruleId) {
    return setRuleEnabled(ruleId, true);
  }

  public AlertRuleDto disableRule(long ruleId) {
    return setRuleEnabled(ruleId, false);
  }

  public RulePage searchRules(RuleSearchCriteria criteria) {
    validator.requirePage(criteria.page(), criteria.pageSize());
    WarningLevel level = criteria.warningLevel() == null
        ? null
        : validator.requireWarningLevel(criteria.warningLevel());
    RuleFilter filter = new RuleFilter(
        criteria.keyword(),
        level,
        criteria.enabled(),
        criteria.createdFrom(),
        criteria.createdTo()
    );
    Page<AlertRuleEntity> page = store.search(filter, criteria.page() - 1, criteria.pageSize());
    return new RulePage(
        page.getTotalElements(),
        criteria.page(),
        criteria.pageSize(),
        page.getContent().stream().map(this::toDto).toList()
    );
  }

  public RuleStats stats() {
    return new RuleStats(store.count(), store.countEnabled());
  }

  private AlertRuleDto setRuleEnabled(long ruleId, boolean enabled) {
    AlertRuleEntity entity = store.setEnabled(ruleId, enabled);
    log.info("{} alarm rule: id={}", enabled ? "Enabled" : "Disabled", ruleId);
    return toDto(entity);
  }

  private AlertRuleEntity rejectingDuplicates(AlertRuleFields fields, Supplier<AlertRuleEntity> write) {
    try {
      return write.get();
    } catch (RuleConstraintException e) {
      if (e.getKind() == RuleConstraintException.Kind.UNIQUE_TUPLE) {
        log.warn("Rejected duplicate alarm rule: {}", fields.tuple());
        throw new DuplicateRuleException(fields.tuple(), e);
      }
      throw e;
    }
  }

  private List<AlertRuleDto> toDtos(List<AlertRuleEntity> entities) {
    return entities.stream().map(this::toDto).toList();
  }

  private AlertRuleDto toDto(AlertRuleEntity entity) {
    return new AlertRuleDto(
        entity.getId(),
        entity.getChannelId(),
        entity.getDataType(),
        entity.getPointId(),
        entity.getRuleName(),
        entity.getWarningLevel(),
        entity.getComparisonOperator(),
        entity.getThreshold(),
        entity.isEnabled(),
        entity.getDescription(),
        entity.getCreatedAt(),
        entity.getUpdatedAt()
    );
  }
}
