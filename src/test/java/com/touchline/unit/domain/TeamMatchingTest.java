package com.touchline.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.touchline.domain.enums.TeamSide;
import com.touchline.domain.model.AlertRule;
import com.touchline.domain.model.MatchSnapshot;
import com.touchline.metrics.MetricsCalculator;
import java.util.Locale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Team and league matching must not depend on the JVM default locale. Runs under
 * Turkish, where upper-case I lowers to a dotless i.
 */
class TeamMatchingTest {

    private Locale originalLocale;

    @BeforeEach
    void setUp() {
        originalLocale = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(originalLocale);
    }

    private MatchSnapshot snapshot(String home, String away, String league) {
        return MatchSnapshot.builder().fixtureId("77").homeTeam(home).awayTeam(away).league(league).build();
    }

    @Test
    @DisplayName("Team reference resolves to the home side regardless of case")
    void resolveSide_ignoresDefaultLocale() {
        MatchSnapshot snapshot = snapshot("IPSWICH TOWN", "Norwich City", "Championship");

        assertThat(snapshot.resolveSide("Ipswich")).isEqualTo(TeamSide.HOME);
        assertThat(snapshot.resolveSide("norwich")).isEqualTo(TeamSide.AWAY);
    }

    @Test
    @DisplayName("Team and league filters match upper-case names")
    void appliesTo_ignoresDefaultLocale() {
        AlertRule rule = AlertRule.builder().id(1L).name("Inter in Serie A").teamFilter("inter").leagueFilter("serie a").build();

        assertThat(rule.appliesTo(snapshot("AC MILAN", "INTER MILAN", "SERIE A"))).isTrue();
        assertThat(rule.appliesTo(snapshot("AC MILAN", "INTER MILAN", "COPPA ITALIA"))).isFalse();
    }

    @Test
    @DisplayName("League weights are found for upper-case league names")
    void leagueWeight_ignoresDefaultLocale() {
        assertThat(new MetricsCalculator().leagueWeight("SERIE A")).isEqualTo(0.90);
        assertThat(new MetricsCalculator().leagueWeight("CHAMPIONS LEAGUE")).isEqualTo(1.1);
    }
}
