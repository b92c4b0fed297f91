package com.voltageems.alarmsrv.controller;

import com.voltageems.alarmsrv.model.AlertRuleDto;
import com.voltageems.alarmsrv.model.AlertRuleRequest;
import com.voltageems.alarmsrv.model.RulePage;
import com.voltageems.alarmsrv.model.RuleSearchCriteria;
import com.voltageems.alarmsrv.model.RuleStats;
import com.voltageems.alarmsrv.service.AlertRuleService;
import jakarta.validation.constraints.Positive;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/alarm-rules")
@Validated
public class AlertRuleController {

  private final AlertRuleService ruleService;

  public AlertRuleController(AlertRuleService ruleService) {
    this.ruleService = ruleService;
  }

  @PostMapping
  public ResponseEntity<AlertRuleDto> createRule(@RequestBody AlertRuleRequest request) {
    AlertRuleDto created = ruleService.createRule(request);
    return ResponseEntity
        .created(URI.create("/api/v1/alarm-rules/" + created.id()))
        .body(created);
  }

  @GetMapping
  public ResponseEntity<List<AlertRuleDto>> listRules(
      @RequestParam(value = "channelId", required = false) Long channelId) {
    List<AlertRuleDto> rules = channelId == null
        ? ruleService.listRules()
        : ruleService.listRulesByChannel(channelId);
    return ResponseEntity.ok(rules);
  }

  @GetMapping("/enabled")
  public ResponseEntity<List<AlertRuleDto>> listEnabledRules() {
    return ResponseEntity.ok(ruleService.listEnabledRules());
  }

  @GetMapping("/point")
  public ResponseEntity<List<AlertRuleDto>> listEnabledRulesForPoint(
      @RequestParam(value = "channelId", required = false) Long channelId,
      @RequestParam(value = "dataType", required = false) String dataType,
      @RequestParam(value = "pointId", required = false) Long pointId) {
    return ResponseEntity.ok(ruleService.listEnabledRulesForPoint(channelId, dataType, pointId));
  }

  @GetMapping("/search")
  public ResponseEntity<RulePage> searchRules(
      @RequestParam(value = "keyword", required = false) String keyword,
      @RequestParam(value = "warningLevel", required = false) Integer warningLevel,
      @RequestParam(value = "enabled", required = false) Boolean enabled,
      @RequestParam(value = "createdFrom", required = false) Instant createdFrom,
      @RequestParam(value = "createdTo", required = false) Instant createdTo,
      @RequestParam(value = "page", defaultValue = "1") int page,
      @RequestParam(value = "pageSize", defaultValue = "10") int pageSize) {
    RuleSearchCriteria criteria = new RuleSearchCriteria(
        keyword, warningLevel, enabled, createdFrom, createdTo, page, pageSize);
    return ResponseEntity.ok(ruleService.searchRules(criteria));
  }

  @GetMapping("/stats")
  public ResponseEntity<RuleStats> stats() {
    return ResponseEntity.ok(ruleService.stats());
  }

  @GetMapping("/{ruleId}")
  public ResponseEntity<AlertRuleDto> getRule(@PathVariable @Positive long ruleId) {
    return ResponseEntity.ok(ruleService.getRule(ruleId));
  }

  @PutMapping("/{ruleId}")
  public ResponseEntity<AlertRuleDto> updateRule(
      @PathVariable @Positive long ruleId,
      @RequestBody AlertRuleRequest request) {
    return ResponseEntity.ok(ruleService.updateRule(ruleId, request));
  }

  @DeleteMapping("/{ruleId}")
  public ResponseEntity<Void> deleteRule(@PathVariable @Positive long ruleId) {
    ruleService.deleteRule(ruleId);
    return ResponseEntity.noContent().build();
  }

  @PatchMapping("/{ruleId}/enable")
  public ResponseEntity<AlertRuleDto> enableRule(@PathVariable @Positive long ruleId) {
    return ResponseEntity.ok(ruleService.enableRule(ruleId));
  }

  @PatchMapping("/{ruleId}/disable")
  public ResponseEntity<AlertRuleDto> disableRule(@PathVariable @Positive long ruleId) {
    return ResponseEntity.ok(ruleService.disableRule(ruleId));
  }
}
