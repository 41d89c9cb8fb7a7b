package com.dynamicpricing.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.dynamicpricing.domain.enums.ScenarioKind;
import java.util.Locale;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ScenarioKindTest {

    @Test
    @DisplayName("Parses names regardless of case and surrounding whitespace")
    void parsesAnyCase() {
        assertThat(ScenarioKind.parse(" fuel_spike ")).contains(ScenarioKind.FUEL_SPIKE);
        assertThat(ScenarioKind.parse("Global_Crisis")).contains(ScenarioKind.GLOBAL_CRISIS);
    }

    @Test
    @DisplayName("Blank and unknown names are empty")
    void blankAndUnknown() {
        assertThat(ScenarioKind.parse(null)).isEmpty();
        assertThat(ScenarioKind.parse("  ")).isEmpty();
        assertThat(ScenarioKind.parse("ALIEN_INVASION")).isEmpty();
    }

    @Test
    @DisplayName("Lower-case i is matched under a Turkish default locale")
    void turkishDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertThat(ScenarioKind.parse("traffic_jam")).contains(ScenarioKind.TRAFFIC_JAM);
            assertThat(ScenarioKind.parse("global_crisis")).contains(ScenarioKind.GLOBAL_CRISIS);
        } finally {
            Locale.setDefault(previous);
        }
    }
}
