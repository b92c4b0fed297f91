package com.voltageems.alarmsrv.service;

import com.voltageems.alarmsrv.exception.DuplicateRuleException;
import com.voltageems.alarmsrv.exception.RuleNotFoundException;
import com.voltageems.alarmsrv.model.AlertRuleDto;
import com.voltageems.alarmsrv.model.AlertRuleRequest;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Walks one rule through its whole lifecycle on a store that starts empty.
 */
@SpringBootTest(properties = "alarm.store.path=target/test-stores/scenario-${random.uuid}/alarm.db")
@DirtiesContext
class ThresholdRuleScenarioTest {

  @Autowired
  private AlertRuleService ruleService;

  @Test
  void temperatureRuleLifecycle() {
    AlertRuleRequest tempHigh = new AlertRuleRequest(
        1001L, "T", 1L, "temp-high", 2, ">", 85.0, null, null);

    AlertRuleDto created = ruleService.createRule(tempHigh);
    assertThat(created.id()).isEqualTo(1L);

    assertThatThrownBy(() -> ruleService.createRule(tempHigh))
        .isInstanceOf(DuplicateRuleException.class);

    List<AlertRuleDto> channelRules = ruleService.listRulesByChannel(1001L);
    assertThat(channelRules).containsExactly(created);

    AlertRuleDto disabled = ruleService.disableRule(1L);
    assertThat(disabled.enabled()).isFalse();

    ruleService.deleteRule(1L);
    assertThatThrownBy(() -> ruleService.getRule(1L))
        .isInstanceOf(RuleNotFoundException.class);
  }
}
