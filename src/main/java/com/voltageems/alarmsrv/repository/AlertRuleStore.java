package com.voltageems.alarmsrv.repository;

import com.voltageems.alarmsrv.enums.DataType;
import com.voltageems.alarmsrv.exception.RuleNotFoundException;
import com.voltageems.alarmsrv.model.AlertRuleFields;
import com.voltageems.alarmsrv.model.RuleFilter;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class AlertRuleStore {

  private final AlertRuleRepository repository;
  private final RuleClock clock;
  private final TransactionTemplate writeTx;
  private final TransactionTemplate readTx;

  public AlertRuleStore(AlertRuleRepository repository,
                        RuleClock clock,
                        PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.clock = clock;
    this.writeTx = new TransactionTemplate(transactionManager);
    this.readTx = new TransactionTemplate(transactionManager);
    this.readTx.setReadOnly(true);
  }

  public AlertRuleEntity insert(AlertRuleFields fields) {
    return inWrite("insert rule", () -> {
      Instant now = clock.next();
      AlertRuleEntity entity = new AlertRuleEntity();
      apply(entity, fields);
      entity.setCreatedAt(now);
      entity.setUpdatedAt(now);
      return repository.saveAndFlush(entity);
    });
  }

  public AlertRuleEntity update(long id, AlertRuleFields fields) {
    return inWrite("update rule " + id, () -> {
      int updated = repository.replaceFields(
          id,
          fields.channelId(),
          fields.dataType(),
          fields.pointId(),
          fields.ruleName(),
          fields.warningLevel(),
          fields.operator(),
          fields.value(),
          fields.enabled(),
          fields.description(),
          clock.next());
      if (updated == 0) {
        throw new RuleNotFoundException(id);
      }
      return load(id);
    });
  }

  public AlertRuleEntity setEnabled(long id, boolean enabled) {
    return inWrite((enabled ? "enable" : "disable") + " rule " + id, () -> {
      if (repository.updateEnabled(id, enabled, clock.next()) == 0) {
        throw new RuleNotFoundException(id);
      }
      return load(id);
    });
  }

  public void delete(long id) {
    inWrite("delete rule " + id, () -> {
      if (repository.removeById(id) == 0) {
        throw new RuleNotFoundException(id);
      }
      return null;
    });
  }

  public AlertRuleEntity get(long id) {
    return inRead("get rule " + id, () -> load(id));
  }

  public List<AlertRuleEntity> list(Long channelId) {
    return inRead("list rules", () -> channelId == null
        ? repository.findAllByOrderByIdAsc()
        : repository.findByChannelIdOrderByIdAsc(channelId));
  }

  public List<AlertRuleEntity> listEnabled() {
    return inRead("list enabled rules", repository::findByEnabledTrueOrderByIdAsc);
  }

  public List<AlertRuleEntity> listEnabledForPoint(long channelId, DataType dataType, long pointId) {
    return inRead("list rules of point", () -> repository
        .findByChannelIdAndDataTypeAndPointIdAndEnabledTrueOrderByWarningLevelDescIdAsc(
            channelId, dataType, pointId));
  }

  /**
   * One page of matching rules ordered by id. {@code pageIndex} is 0-based.
   */
  public Page<AlertRuleEntity> search(RuleFilter filter, int pageIndex, int pageSize) {
    PageRequest pageRequest = PageRequest.of(pageIndex, pageSize, Sort.by(Sort.Direction.ASC, "id"));
    return inRead("search rules", () ->
        repository.findAll(AlertRuleSpecifications.matching(filter), pageRequest));
  }

  public long count() {
    return inRead("count rules", repository::count);
  }

  public long countEnabled() {
    return inRead("count enabled rules", repository::countByEnabledTrue);
  }

  private AlertRuleEntity load(long id) {
    return repository.findById(id).orElseThrow(() -> new RuleNotFoundException(id));
  }

  private static void apply(AlertRuleEntity entity, AlertRuleFields fields) {
    entity.setChannelId(fields.channelId());
    entity.setDataType(fields.dataType());
    entity.setPointId(fields.pointId());
    entity.setRuleName(fields.ruleName());
    entity.setWarningLevel(fields.warningLevel());
    entity.setComparisonOperator(fields.operator());
    entity.setThreshold(fields.value());
    entity.setEnabled(fields.enabled());
    entity.setDescription(fields.description());
  }

  private <T> T inWrite(String operation, Supplier<T> work) {
    return execute(writeTx, operation, work);
  }

  private <T> T inRead(String operation, Supplier<T> work) {
    return execute(readTx, operation, work);
  }

  // Commit failures surface from execute() itself, so they are classified too.
  private static <T> T execute(TransactionTemplate tx, String operation, Supplier<T> work) {
    try {
      return tx.execute(status -> work.get());
    } catch (RuntimeException e) {
      throw StorageErrorClassifier.classify(operation, e);
    }
  }
}
