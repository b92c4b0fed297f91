package com.voltageems.alarmsrv.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voltageems.alarmsrv.enums.ComparisonOperator;
import com.voltageems.alarmsrv.enums.DataType;
import com.voltageems.alarmsrv.enums.WarningLevel;
import com.voltageems.alarmsrv.exception.DuplicateRuleException;
import com.voltageems.alarmsrv.exception.RuleConstraintException;
import com.voltageems.alarmsrv.exception.RuleNotFoundException;
import com.voltageems.alarmsrv.exception.RuleValidationException;
import com.voltageems.alarmsrv.exception.StorageUnavailableException;
import com.voltageems.alarmsrv.model.AlertRuleDto;
import com.voltageems.alarmsrv.model.AlertRuleRequest;
import com.voltageems.alarmsrv.model.RulePage;
import com.voltageems.alarmsrv.model.RuleSearchCriteria;
import com.voltageems.alarmsrv.model.RuleStats;
import com.voltageems.alarmsrv.model.RuleTuple;
import com.voltageems.alarmsrv.service.AlertRuleService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AlertRuleController.class)
class AlertRuleControllerTest {

  private static final Instant CREATED = Instant.parse("2026-03-01T08:00:00Z");

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  private ObjectMapper objectMapper;

  @MockBean
  private AlertRuleService ruleService;

  @Test
  void createReturns201WithLocationAndWireCodes() throws Exception {
    AlertRuleRequest request = new AlertRuleRequest(
        1001L, "T", 1L, "temp-high", 2, ">", 85.0, null, null);
    given(ruleService.createRule(any(AlertRuleRequest.class))).willReturn(rule(7L, true));

    mockMvc.perform(
            post("/api/v1/alarm-rules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request))
        )
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/api/v1/alarm-rules/7"))
        .andExpect(jsonPath("$.id").value(7))
        .andExpect(jsonPath("$.channelId").value(1001))
        .andExpect(jsonPath("$.dataType").value("T"))
        .andExpect(jsonPath("$.warningLevel").value(2))
        .andExpect(jsonPath("$.operator").value(">"))
        .andExpect(jsonPath("$.value").value(85.0))
        .andExpect(jsonPath("$.enabled").value(true));
  }

  @Test
  void validationFailureReturns400NamingTheField() throws Exception {
    given(ruleService.createRule(any(AlertRuleRequest.class)))
        .willThrow(new RuleValidationException("warningLevel", "must be 1, 2 or 3"));

    mockMvc.perform(
            post("/api/v1/alarm-rules")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"channelId":1,"dataType":"T","pointId":1,"ruleName":"r",
                     "warningLevel":5,"operator":">","value":1.0}
                    """)
        )
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.status").value(400))
        .andExpect(jsonPath("$.field").value("warningLevel"));
  }

  @Test
  void malformedJsonReturns400() throws Exception {
    mockMvc.perform(
            post("/api/v1/alarm-rules")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"channelId\": ")
        )
        .andExpect(status().isBadRequest());

    verifyNoInteractions(ruleService);
  }

  @Test
  void duplicateReturns409WithTheTuple() throws Exception {
    RuleTuple tuple = new RuleTuple(1001L, DataType.TELEMETRY, 1L, "temp-high");
    given(ruleService.updateRule(eq(3L), any(AlertRuleRequest.class)))
        .willThrow(new DuplicateRuleException(tuple, null));

    mockMvc.perform(
            put("/api/v1/alarm-rules/3")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new AlertRuleRequest(
                    1001L, "T", 1L, "temp-high", 2, ">", 85.0, true, "")))
        )
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.dataType").value("T"))
        .andExpect(jsonPath("$.ruleName").value("temp-high"));
  }

  @Test
  void constraintViolationReturns422() throws Exception {
    given(ruleService.createRule(any(AlertRuleRequest.class)))
        .willThrow(new RuleConstraintException(
            RuleConstraintException.Kind.CHECK, "insert rule rejected by store", null));

    mockMvc.perform(
            post("/api/v1/alarm-rules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new AlertRuleRequest(
                    1L, "T", 1L, "r", 1, ">", 1.0, null, null)))
        )
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.constraint").value("CHECK"));
  }

  @Test
  void missingRuleReturns404() throws Exception {
    given(ruleService.getRule(42L)).willThrow(new RuleNotFoundException(42L));
    willThrow(new RuleNotFoundException(43L)).given(ruleService).deleteRule(43L);

    mockMvc.perform(get("/api/v1/alarm-rules/42"))
        .andExpect(status().isNotFound());
    mockMvc.perform(delete("/api/v1/alarm-rules/43"))
        .andExpect(status().isNotFound());
  }

  @Test
  void nonPositiveOrNonNumericIdReturns400() throws Exception {
    mockMvc.perform(get("/api/v1/alarm-rules/0"))
        .andExpect(status().isBadRequest());
    mockMvc.perform(get("/api/v1/alarm-rules/abc"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(ruleService);
  }

  @Test
  void storageOutageReturns503() throws Exception {
    given(ruleService.listRules())
        .willThrow(new StorageUnavailableException("list rules failed, rule store unavailable", null));

    mockMvc.perform(get("/api/v1/alarm-rules"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.status").value(503));
  }

  @Test
  void deleteReturns204() throws Exception {
    mockMvc.perform(delete("/api/v1/alarm-rules/5"))
        .andExpect(status().isNoContent());

    verify(ruleService).deleteRule(5L);
  }

  @Test
  void enableAndDisableReturnTheRule() throws Exception {
    given(ruleService.enableRule(7L)).willReturn(rule(7L, true));
    given(ruleService.disableRule(7L)).willReturn(rule(7L, false));

    mockMvc.perform(patch("/api/v1/alarm-rules/7/enable"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enabled").value(true));
    mockMvc.perform(patch("/api/v1/alarm-rules/7/disable"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enabled").value(false));
  }

  @Test
  void listFiltersByChannelWhenGiven() throws Exception {
    given(ruleService.listRulesByChannel(1001L)).willReturn(List.of(rule(7L, true)));

    mockMvc.perform(get("/api/v1/alarm-rules").param("channelId", "1001"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(7));

    verify(ruleService).listRulesByChannel(1001L);
  }

  @Test
  void searchPassesCriteriaAndDefaultsPaging() throws Exception {
    RuleSearchCriteria expected = new RuleSearchCriteria("temp", 3, true, null, null, 1, 10);
    given(ruleService.searchRules(expected))
        .willReturn(new RulePage(1, 1, 10, List.of(rule(7L, true))));

    mockMvc.perform(
            get("/api/v1/alarm-rules/search")
                .param("keyword", "temp")
                .param("warningLevel", "3")
                .param("enabled", "true")
        )
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(1))
        .andExpect(jsonPath("$.page").value(1))
        .andExpect(jsonPath("$.pageSize").value(10))
        .andExpect(jsonPath("$.items[0].ruleName").value("temp-high"));
  }

  @Test
  void statsReportsTotals() throws Exception {
    given(ruleService.stats()).willReturn(new RuleStats(4, 3));

    mockMvc.perform(get("/api/v1/alarm-rules/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(4))
        .andExpect(jsonPath("$.enabled").value(3));
  }

  private static AlertRuleDto rule(long id, boolean enabled) {
    return new AlertRuleDto(id, 1001L, DataType.TELEMETRY, 1L, "temp-high", WarningLevel.MEDIUM,
        ComparisonOperator.GREATER_THAN, 85.0, enabled, "", CREATED, CREATED);
  }
}
