package com.aclforge.compiler.io;

import com.aclforge.api.exceptions.ValidationException;
import com.aclforge.api.model.Action;
import com.aclforge.api.model.Address;
import com.aclforge.api.model.Filter;
import com.aclforge.api.model.Policy;
import com.aclforge.api.model.PortRange;
import com.aclforge.api.model.Term;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyLoaderTest {

    private static final String POLICY = """
            {
              "filters": [
                {
                  "header": {
                    "targets": [
                      {"platform": "juniper", "options": ["edge-in", "inet"]},
                      {"platform": "iptables", "options": ["INPUT", "DROP"]}
                    ],
                    "comment": ["Edge ingress"]
                  },
                  "terms": [
                    {
                      "name": "allow-web",
                      "action": "accept",
                      "protocol": ["tcp"],
                      "destination_address": [
                        {"cidr": "10.0.0.0/8", "token": "INTERNAL", "comment": "corp space"}
                      ],
                      "destination_address_exclude": [{"cidr": "10.1.0.0/16"}],
                      "destination_port": ["80", "8000-8080"],
                      "expiration": "2030-12-31",
                      "platform_exclude": ["cisco"],
                      "counter": "web"
                    },
                    {
                      "name": "deny-rest",
                      "action": "reject-with-tcp-rst",
                      "stateless_reply": true
                    }
                  ]
                }
              ]
            }
            """;

    private PolicyLoader loader;

    @BeforeEach
    void setUp() {
        loader = new PolicyLoader();
    }

    @Test
    @DisplayName("Should map every JSON keyword onto the policy model")
    void shouldReadPolicy() throws IOException {
        Policy policy = loader.read(POLICY);

        assertThat(policy.filters()).hasSize(1);
        Filter filter = policy.filters().get(0);
        assertThat(filter.header().platforms()).containsExactly("juniper", "iptables");
        assertThat(filter.header().filterName("iptables")).isEqualTo("INPUT");
        assertThat(filter.header().comments()).containsExactly("Edge ingress");

        Term web = filter.terms().get(0);
        assertThat(web.action()).isEqualTo(Action.ACCEPT);
        assertThat(web.protocols()).containsExactly("tcp");
        assertThat(web.destinationAddresses()).containsExactly(Address.parse("10.0.0.0/8"));
        assertThat(web.destinationAddresses().get(0).token()).isEqualTo("INTERNAL");
        assertThat(web.destinationAddresses().get(0).comment()).isEqualTo("corp space");
        assertThat(web.destinationAddressExcludes()).containsExactly(Address.parse("10.1.0.0/16"));
        assertThat(web.destinationPorts()).containsExactly(PortRange.of(80), PortRange.of(8000, 8080));
        assertThat(web.expiration()).isEqualTo(LocalDate.of(2030, 12, 31));
        assertThat(web.platformExcludes()).containsExactly("cisco");
        assertThat(web.counter()).isEqualTo("web");
        assertThat(web.statelessReply()).isFalse();

        Term rest = filter.terms().get(1);
        assertThat(rest.action()).isEqualTo(Action.REJECT_WITH_TCP_RST);
        assertThat(rest.statelessReply()).isTrue();
        assertThat(rest.sourceAddresses()).isEmpty();
    }

    @Test
    @DisplayName("Should read from a file and from a stream")
    void shouldLoadFromFileAndStream(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("edge.json");
        Files.writeString(file, POLICY);

        assertThat(loader.load(file).filters()).hasSize(1);
        assertThat(loader.read(new ByteArrayInputStream(POLICY.getBytes(StandardCharsets.UTF_8))).filters())
                .hasSize(1);
    }

    @Test
    @DisplayName("Unknown actions are rejected")
    void unknownAction() {
        String json = """
                {"filters": [{"header": {"targets": [{"platform": "juniper", "options": ["f"]}]},
                  "terms": [{"name": "t", "action": "permit"}]}]}
                """;

        assertThatThrownBy(() -> loader.read(json))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("permit");
    }

    @Test
    @DisplayName("Malformed addresses and ports are validation errors")
    void malformedValues() {
        String badCidr = """
                {"filters": [{"header": {"targets": [{"platform": "juniper", "options": ["f"]}]},
                  "terms": [{"name": "t", "action": "accept", "source_address": [{"cidr": "10.0.0.300/8"}]}]}]}
                """;
        String badPort = """
                {"filters": [{"header": {"targets": [{"platform": "juniper", "options": ["f"]}]},
                  "terms": [{"name": "t", "action": "accept", "destination_port": ["http"]}]}]}
                """;

        assertThatThrownBy(() -> loader.read(badCidr))
                .isInstanceOf(ValidationException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> loader.read(badPort)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Policies need filters, targets and term names")
    void structuralErrors() {
        assertThatThrownBy(() -> loader.read("{\"filters\": []}"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> loader.read("{\"filters\": [{\"header\": {\"targets\": []}}]}"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> loader.read(
                "{\"filters\": [{\"header\": {\"targets\": [{\"platform\": \"juniper\"}]}, \"terms\": [{}]}]}"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("name");
    }
}
