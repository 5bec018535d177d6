package com.aclforge.compiler.render;

import com.aclforge.api.Renderer;
import com.aclforge.api.RendererState;
import com.aclforge.api.SkipReason;
import com.aclforge.api.SkippedTerm;
import com.aclforge.api.ValidationConfig;
import com.aclforge.api.exceptions.DuplicateNameException;
import com.aclforge.api.exceptions.ErrorKind;
import com.aclforge.api.exceptions.PolicyCompilationException;
import com.aclforge.api.exceptions.UnsupportedFeatureException;
import com.aclforge.api.exceptions.ValidationException;
import com.aclforge.api.model.Action;
import com.aclforge.api.model.Address;
import com.aclforge.api.model.Filter;
import com.aclforge.api.model.Header;
import com.aclforge.api.model.Policy;
import com.aclforge.api.model.PortRange;
import com.aclforge.api.model.Term;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;

class RendererContractTest {

    private static final Tracer TRACER = OpenTelemetry.noop().getTracer("test");
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);
    private static final ValidationConfig CONFIG = ValidationConfig.of(TODAY);

    private static final Header BOTH = new Header(List.of(
            new Header.Target("iptables", List.of("INPUT")),
            new Header.Target("juniper", List.of("edge-in"))), List.of("Shared edge policy"));

    private static Policy policy(Term... terms) {
        return Policy.of(new Filter(BOTH, List.of(terms)));
    }

    private static Term web() {
        return Term.builder("allow-web").action(Action.ACCEPT).protocols("tcp")
                .destinationAddresses(Address.parse("10.0.0.0/8"))
                .destinationPorts(PortRange.of(80)).build();
    }

    @ParameterizedTest
    @ValueSource(strings = {"iptables", "juniper"})
    @DisplayName("translate may only be called once")
    void translateOnce(String platform) {
        Renderer renderer = Renderers.forPlatform(platform, TRACER);
        renderer.translate(policy(web()), CONFIG);

        assertThat(renderer.state()).isEqualTo(RendererState.TRANSLATED);
        assertThatThrownBy(() -> renderer.translate(policy(web()), CONFIG))
                .isInstanceOf(IllegalStateException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"iptables", "juniper"})
    @DisplayName("render requires a translated policy")
    void renderBeforeTranslate(String platform) {
        Renderer renderer = Renderers.forPlatform(platform, TRACER);

        assertThat(renderer.state()).isEqualTo(RendererState.CREATED);
        assertThatThrownBy(renderer::render).isInstanceOf(IllegalStateException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"iptables", "juniper"})
    @DisplayName("A failed translation leaves the renderer without output")
    void failedTranslation(String platform) {
        Renderer renderer = Renderers.forPlatform(platform, TRACER);
        Policy duplicates = policy(web(), web());

        PolicyCompilationException error = catchThrowableOfType(
                () -> renderer.translate(duplicates, CONFIG), PolicyCompilationException.class);

        assertThat(error).isInstanceOf(DuplicateNameException.class);
        assertThat(error.getKind()).isEqualTo(ErrorKind.DUPLICATE_NAME);
        assertThat(renderer.state()).isEqualTo(RendererState.FAILED);
        assertThatThrownBy(renderer::render).isInstanceOf(IllegalStateException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"iptables", "juniper"})
    @DisplayName("Expired terms are skipped and terms close to expiry are kept")
    void expiration(String platform) {
        Renderer renderer = Renderers.forPlatform(platform, TRACER);
        Term expired = Term.builder("old-rule").action(Action.DENY).expiration(TODAY.minusDays(1)).build();
        Term expiring = Term.builder("soon-rule").action(Action.DENY).expiration(TODAY.plusDays(3)).build();

        renderer.translate(policy(expired, expiring), CONFIG);
        String output = renderer.render();

        assertThat(output).contains("soon-rule").doesNotContain("old-rule");
        assertThat(renderer.skippedTerms()).extracting(SkippedTerm::termName, SkippedTerm::reason)
                .containsExactly(tuple("old-rule", SkipReason.EXPIRED));
    }

    @ParameterizedTest
    @ValueSource(strings = {"iptables", "juniper"})
    @DisplayName("Term platform lists gate rendering")
    void platformGating(String platform) {
        Renderer renderer = Renderers.forPlatform(platform, TRACER);
        Term excluded = Term.builder("not-here").action(Action.ACCEPT).platformExcludes(Set.of(platform)).build();
        Term elsewhere = Term.builder("elsewhere").action(Action.ACCEPT).platforms(Set.of("cisco")).build();

        renderer.translate(policy(excluded, elsewhere, web()), CONFIG);

        assertThat(renderer.skippedTerms()).extracting(SkippedTerm::reason)
                .containsExactly(SkipReason.PLATFORM_MISMATCH, SkipReason.PLATFORM_MISMATCH);
        assertThat(renderer.render()).contains("allow-web");
    }

    @ParameterizedTest
    @ValueSource(strings = {"iptables", "juniper"})
    @DisplayName("A term without action or verbatim text is invalid")
    void missingAction(String platform) {
        Renderer renderer = Renderers.forPlatform(platform, TRACER);

        assertThatThrownBy(() -> renderer.translate(policy(Term.builder("empty").build()), CONFIG))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("has no action");
    }

    @ParameterizedTest
    @ValueSource(strings = {"iptables", "juniper"})
    @DisplayName("Filters for other platforms are ignored")
    void otherPlatformsIgnored(String platform) {
        Renderer renderer = Renderers.forPlatform(platform, TRACER);
        Policy policy = Policy.of(new Filter(Header.of("cisco", "acl-1"), List.of(web())));

        renderer.translate(policy, CONFIG);

        assertThat(renderer.render()).isEqualTo("\n");
    }

    @Test
    @DisplayName("iptables rejects keywords only juniper can express")
    void iptablesRejectsPrecedence() {
        Renderer renderer = Renderers.forPlatform("iptables", TRACER);
        Term term = Term.builder("qos").action(Action.ACCEPT).precedence(List.of(3)).build();

        assertThatThrownBy(() -> renderer.translate(policy(term), CONFIG))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("precedence");
    }

    @Test
    @DisplayName("Independent renderers translate the same policy concurrently")
    void concurrentRenderers() throws Exception {
        Policy policy = policy(web(), Term.builder("deny-all").action(Action.DENY).build());
        String expected = render("juniper", policy);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(executor.submit(() -> render("juniper", policy)));
            }
            for (Future<String> result : results) {
                assertThat(result.get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static String render(String platform, Policy policy) {
        Renderer renderer = Renderers.forPlatform(platform, TRACER);
        renderer.translate(policy, CONFIG);
        return renderer.render();
    }

    @Test
    @DisplayName("The factory knows iptables and juniper only")
    void factory() {
        assertThat(Renderers.platforms()).containsExactly("iptables", "juniper");
        assertThat(Renderers.forPlatform("juniper", TRACER).platform()).isEqualTo("juniper");
        assertThat(Renderers.forPlatform("iptables", TRACER))
                .isNotSameAs(Renderers.forPlatform("iptables", TRACER));
        assertThatThrownBy(() -> Renderers.forPlatform("cisco", TRACER))
                .isInstanceOf(UnsupportedFeatureException.class)
                .hasMessageContaining("cisco");
    }
}
