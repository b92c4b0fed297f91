package com.voltageems.alarmsrv.repository;

import com.voltageems.alarmsrv.enums.ComparisonOperator;
import com.voltageems.alarmsrv.enums.DataType;
import com.voltageems.alarmsrv.enums.WarningLevel;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;

// Table and check constraints are created by db/schema.sql.
@Entity
@Table(
    name = "alert_rule",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_alert_rule_tuple",
        columnNames = {"channel_id", "data_type", "point_id", "rule_name"}
    )
)
public class AlertRuleEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false, updatable = false)
  private Long id;

  @Column(name = "channel_id", nullable = false)
  private long channelId;

  @Convert(converter = DataTypeConverter.class)
  @Column(name = "data_type", nullable = false, length = 1)
  private DataType dataType;

  @Column(name = "point_id", nullable = false)
  private long pointId;

  @Column(name = "rule_name", nullable = false)
  private String ruleName;

  @Convert(converter = WarningLevelConverter.class)
  @Column(name = "warning_level", nullable = false)
  private WarningLevel warningLevel;

  @Convert(converter = ComparisonOperatorConverter.class)
  @Column(name = "operator", nullable = false, length = 2)
  private ComparisonOperator comparisonOperator;

  @Column(name = "value", nullable = false)
  private double threshold;

  @Column(name = "enabled", nullable = false)
  private boolean enabled;

  @Column(name = "description", nullable = false)
  private String description;

  @Convert(converter = EpochMillisConverter.class)
  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Convert(converter = EpochMillisConverter.class)
  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  public AlertRuleEntity() {}

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public long getChannelId() {
    return channelId;
  }

  public void setChannelId(long channelId) {
    this.channelId = channelId;
  }

  public DataType getDataType() {
    return dataType;
  }

  public void setDataType(DataType dataType) {
    this.dataType = dataType;
  }

  public long getPointId() {
    return pointId;
  }

  public void setPointId(long pointId) {
    this.pointId = pointId;
  }

  public String getRuleName() {
    return ruleName;
  }

  public void setRuleName(String ruleName) {
    this.ruleName = ruleName;
  }

  public WarningLevel getWarningLevel() {
    return warningLevel;
  }

  public void setWarningLevel(WarningLevel warningLevel) {
    this.warningLevel = warningLevel;
  }

  public ComparisonOperator getComparisonOperator() {
    return comparisonOperator;
  }

  public void setComparisonOperator(ComparisonOperator comparisonOperator) {
    this.comparisonOperator = comparisonOperator;
  }

  public double getThreshold() {
    return threshold;
  }

  public void setThreshold(double threshold) {
    this.threshold = threshold;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
