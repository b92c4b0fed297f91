package com.voltageems.alarmsrv.repository;

import com.voltageems.alarmsrv.enums.ComparisonOperator;
import com.voltageems.alarmsrv.enums.DataType;
import com.voltageems.alarmsrv.enums.WarningLevel;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AlertRuleRepository
    extends JpaRepository<AlertRuleEntity, Long>, JpaSpecificationExecutor<AlertRuleEntity> {

  List<AlertRuleEntity> findAllByOrderByIdAsc();

  List<AlertRuleEntity> findByChannelIdOrderByIdAsc(long channelId);

  List<AlertRuleEntity> findByEnabledTrueOrderByIdAsc();

  List<AlertRuleEntity> findByChannelIdAndDataTypeAndPointIdAndEnabledTrueOrderByWarningLevelDescIdAsc(
      long channelId, DataType dataType, long pointId);

  long countByEnabledTrue();

  // Writes below are single statements so the write lock is the first lock taken.

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("""
      update AlertRuleEntity r set
        r.channelId = :channelId,
        r.dataType = :dataType,
        r.pointId = :pointId,
        r.ruleName = :ruleName,
        r.warningLevel = :warningLevel,
        r.comparisonOperator = :comparisonOperator,
        r.threshold = :threshold,
        r.enabled = :enabled,
        r.description = :description,
        r.updatedAt = :updatedAt
      where r.id = :id
      """)
  int replaceFields(
      @Param("id") long id,
      @Param("channelId") long channelId,
      @Param("dataType") DataType dataType,
      @Param("pointId") long pointId,
      @Param("ruleName") String ruleName,
      @Param("warningLevel") WarningLevel warningLevel,
      @Param("comparisonOperator") ComparisonOperator comparisonOperator,
      @Param("threshold") double threshold,
      @Param("enabled") boolean enabled,
      @Param("description") String description,
      @Param("updatedAt") Instant updatedAt);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("update AlertRuleEntity r set r.enabled = :enabled, r.updatedAt = :updatedAt where r.id = :id")
  int updateEnabled(
      @Param("id") long id,
      @Param("enabled") boolean enabled,
      @Param("updatedAt") Instant updatedAt);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("delete from AlertRuleEntity r where r.id = :id")
  int removeById(@Param("id") long id);
}
