package io.mnemo.core.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.goal.GoalPriority;
import io.mnemo.core.memory.MemoryCategory;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class ExtractionResponseParserTest {

    private final ExtractionResponseParser parser = new ExtractionResponseParser();

    @Test
    void shouldParseBareArrayOfMemories() throws Exception {
        ExtractionResult result = parser.parse("""
            [{"content": "Works as a teacher", "category": "fact", "importance": 0.8}]
            """);

        assertThat(result.memories()).singleElement().satisfies(memory -> {
            assertThat(memory.content()).isEqualTo("Works as a teacher");
            assertThat(memory.category()).isEqualTo(MemoryCategory.FACT);
            assertThat(memory.importance()).isEqualTo(0.8);
        });
        assertThat(result.goals()).isEmpty();
    }

    @Test
    void shouldParseFencedObjectWithGoalsAndProfile() throws Exception {
        ExtractionResult result = parser.parse("""
            ```json
            {
              "memories": [{"content": "Enjoys bouldering", "category": "preference", "importance": 0.6}],
              "goals": [{"title": "Climb a V5", "deadline": "2026-06-30", "priority": "high"}],
              "user_profile": [{"key": "name", "value": "Aiko", "category": "personal"}]
            }
            ```
            """);

        assertThat(result.memories()).singleElement()
            .satisfies(memory -> assertThat(memory.importance()).isEqualTo(0.6));
        assertThat(result.goals()).singleElement().satisfies(goal -> {
            assertThat(goal.deadline()).isEqualTo(LocalDate.of(2026, 6, 30));
            assertThat(goal.priority()).isEqualTo(GoalPriority.HIGH);
        });
        assertThat(result.profile()).singleElement()
            .satisfies(fact -> assertThat(fact.value()).isEqualTo("Aiko"));
    }

    @Test
    void shouldRejectMalformedOutput() {
        assertThatThrownBy(() -> parser.parse("Sure! Here is what I found: user likes tea"))
            .isInstanceOf(ExtractionParseException.class);
        assertThatThrownBy(() -> parser.parse(""))
            .isInstanceOf(ExtractionParseException.class);
        assertThatThrownBy(() -> parser.parse("\"just a string\""))
            .isInstanceOf(ExtractionParseException.class);
    }

    @Test
    void shouldRejectMemoryWithoutImportance() {
        assertThatThrownBy(() -> parser.parse("""
            [{"content": "Works as a teacher in Osaka", "category": "fact"}]
            """))
            .isInstanceOf(ExtractionParseException.class)
            .hasMessageContaining("importance");
        assertThatThrownBy(() -> parser.parse("""
            {"memories": [{"content": "Works as a teacher in Osaka", "category": "fact", "importance": null}]}
            """))
            .isInstanceOf(ExtractionParseException.class)
            .hasMessageContaining("importance");
    }

    @Test
    void shouldRejectProseAfterJson() {
        assertThatThrownBy(() -> parser.parse("[] some prose"))
            .isInstanceOf(ExtractionParseException.class);
        assertThatThrownBy(() -> parser.parse("""
            [{"content": "Likes tea", "category": "preference", "importance": 0.4}]
            Let me know if you need anything else.
            """))
            .isInstanceOf(ExtractionParseException.class);
    }

    @Test
    void shouldRejectWholeBatchWhenOneEntryIsInvalid() {
        assertThatThrownBy(() -> parser.parse("""
            [
              {"content": "Likes tea", "category": "preference", "importance": 0.4},
              {"content": "Has a dog", "category": "pet", "importance": 0.6}
            ]
            """)).isInstanceOf(ExtractionParseException.class);
        assertThatThrownBy(() -> parser.parse("""
            [{"content": "Likes tea", "category": "preference", "importance": 4}]
            """)).isInstanceOf(ExtractionParseException.class);
    }

    @Test
    void shouldStripCodeFences() {
        assertThat(ExtractionResponseParser.stripFences("```\n[]\n```")).isEqualTo("[]");
        assertThat(ExtractionResponseParser.stripFences("  []  ")).isEqualTo("[]");
    }
}
