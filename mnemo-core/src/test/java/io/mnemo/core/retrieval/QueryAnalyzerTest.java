package io.mnemo.core.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryAnalyzerTest {

    @Test
    void shouldExpandJobIntoRelatedTerms() {
        List<String> terms = QueryAnalyzer.withDefaults().terms("What is my job?");

        assertThat(terms).startsWith("job").contains("work", "occupation", "profession");
    }

    @Test
    void shouldQuoteTermsAndJoinWithOr() {
        QueryAnalyzer analyzer = new QueryAnalyzer(Map.of("tea", List.of("matcha")));

        assertThat(analyzer.matchExpression("green tea")).isEqualTo("\"green\" OR \"tea\" OR \"matcha\"");
    }

    @Test
    void shouldReturnEmptyExpressionForStopWordsOnly() {
        assertThat(QueryAnalyzer.withDefaults().matchExpression("what is the")).isEmpty();
        assertThat(QueryAnalyzer.withDefaults().matchExpression(null)).isEmpty();
    }

    @Test
    void shouldNeutralizeFullTextOperators() {
        String expression = QueryAnalyzer.withDefaults().matchExpression("coffee* NEAR(\"tea\")");

        assertThat(expression).isEqualTo("\"coffee\" OR \"near\" OR \"tea\"");
    }
}
