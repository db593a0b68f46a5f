package com.reqgraph.core.query;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link QueryIntentDetector}.
 */
class QueryIntentDetectorTest {

    static Stream<Arguments> everyRuleToken() {
        return QueryIntentDetector.RULES.stream()
            .flatMap(rule -> rule.tokens().stream().map(token -> Arguments.of(rule, token)));
    }

    @ParameterizedTest
    @MethodSource("everyRuleToken")
    void detect_eachTokenSelectsFirstMatchingRule(IntentRule rule, String token) {
        QueryType detected = QueryIntentDetector.detect("show " + token.toUpperCase() + " for FR-001");

        // "coverage" contains "cover", so the relationship rule claims it first
        IntentRule first = QueryIntentDetector.RULES.stream()
            .filter(candidate -> candidate.matches(token))
            .findFirst()
            .orElseThrow();
        assertThat(detected).isEqualTo(first.type());
        assertThat(QueryIntentDetector.RULES.indexOf(first)).isLessThanOrEqualTo(QueryIntentDetector.RULES.indexOf(rule));
    }

    @Test
    void rules_areEvaluatedInPriorityOrder() {
        assertThat(QueryIntentDetector.RULES)
            .extracting(IntentRule::type)
            .containsExactly(QueryType.IMPACT, QueryType.RELATIONSHIP, QueryType.PATTERN,
                QueryType.GAP, QueryType.COVERAGE);
    }

    @Test
    void detect_firstMatchWins() {
        assertThat(QueryIntentDetector.detect("what is the impact of missing tests")).isEqualTo(QueryType.IMPACT);
        assertThat(QueryIntentDetector.detect("coverage of contracts")).isEqualTo(QueryType.RELATIONSHIP);
        assertThat(QueryIntentDetector.detect("is the index complete")).isEqualTo(QueryType.COVERAGE);
        assertThat(QueryIntentDetector.detect("gaps")).isEqualTo(QueryType.GAP);
    }

    @Test
    void detect_noRuleMatches_fallsBackToKeyword() {
        assertThat(QueryIntentDetector.detect("user authentication")).isEqualTo(QueryType.KEYWORD);
    }

    @Test
    void entityIdExtractor_findsDistinctIdsCaseInsensitively() {
        assertThat(EntityIdExtractor.extract("compare FR-001, uow-0042 and FR-001 but not X-1 or ABCDE-123"))
            .containsExactly("FR-001", "uow-0042");
    }
}
