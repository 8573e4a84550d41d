package com.regressionsentinel.core.alerting;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TemplateRenderer}.
 */
class TemplateRendererTest {

    @Test
    @DisplayName("Should substitute known placeholders and keep unknown ones")
    void shouldSubstitutePlaceholders() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("testName", "checkout");
        data.put("score", "42.5");

        String rendered = TemplateRenderer.render("{{testName}} scored {{score}} ({{missing}})", data);

        assertThat(rendered).isEqualTo("checkout scored 42.5 ({{missing}})");
    }

    @Test
    @DisplayName("Should not interpret replacement values as regex groups")
    void shouldQuoteReplacementValues() {
        String rendered = TemplateRenderer.render("cost: {{price}}", Map.of("price", "$1 \\o/"));
        assertThat(rendered).isEqualTo("cost: $1 \\o/");
    }

    @Test
    @DisplayName("Should repeat an each-block once per item")
    void shouldExpandEachBlock() {
        String template = "Recommendations:\n{{#each recommendations}}\n- {{this}}\n{{/each}}\nEnd";
        Map<String, Object> data = Map.of("recommendations", List.of("Add an index", "Raise the pool size"));

        String rendered = TemplateRenderer.render(template, data);

        assertThat(rendered).isEqualTo("Recommendations:\n- Add an index\n- Raise the pool size\nEnd");
    }

    @Test
    @DisplayName("Should render an each-block over a missing or empty list as nothing")
    void shouldDropEachBlockWithoutItems() {
        String template = "A{{#each items}}<{{this}}>{{/each}}B";

        assertThat(TemplateRenderer.render(template, Map.of())).isEqualTo("AB");
        assertThat(TemplateRenderer.render(template, Map.of("items", List.of()))).isEqualTo("AB");
        assertThat(TemplateRenderer.render(template, Map.of("items", "not a list"))).isEqualTo("AB");
    }

    @Test
    @DisplayName("Should return an empty string for an empty template")
    void shouldHandleEmptyTemplate() {
        assertThat(TemplateRenderer.render(null, Map.of())).isEmpty();
        assertThat(TemplateRenderer.render("", Map.of("a", 1))).isEmpty();
    }

    @Test
    @DisplayName("Should strip markup and unescape entities for the text body")
    void shouldConvertHtmlToText() {
        String html = "<h2>Title</h2>\n<p><strong>Test:</strong> a &amp; b</p>\n  <ul>\n"
                + "  <li>x &lt; y</li>\n</ul>\n\n\n\n<p>line<br/>break</p>";

        String text = TemplateRenderer.toText(html);

        assertThat(text).isEqualTo("Title\nTest: a & b\n\nx < y\n\nline\nbreak");
    }

    @Test
    @DisplayName("Should render the built-in performance template into readable text")
    void shouldRenderDefaultPerformanceTemplate() {
        AlertTemplates templates = AlertTemplates.defaults();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("testName", "search");
        data.put("severity", "major");
        data.put("score", "35.0");
        data.put("responseTimeChange", "40.2");
        data.put("throughputChange", "-12.0");
        data.put("errorRateChange", "0.5");
        data.put("recommendations", List.of("Profile the query planner"));
        data.put("alertId", "a-1");
        data.put("timestamp", "2024-03-01T10:00:00Z");

        String subject = TemplateRenderer.render(
                templates.get(AlertTemplates.PERFORMANCE_REGRESSION).getSubject(), data);
        String text = TemplateRenderer.toText(TemplateRenderer.render(
                templates.get(AlertTemplates.PERFORMANCE_REGRESSION).getBody(), data));

        assertThat(subject).isEqualTo("Performance Regression Detected: search");
        assertThat(text)
                .contains("Test: search")
                .contains("Overall Score: 35.0/100")
                .contains("Response Time: 40.2%")
                .contains("- Profile the query planner")
                .contains("Alert ID: a-1")
                .doesNotContain("{{")
                .doesNotContain("<");
    }
}
