package com.aclforge.compiler.render.juniper;

import com.aclforge.api.exceptions.StructuralException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JuniperConfigTest {

    @Test
    @DisplayName("Nested blocks are indented by four spaces")
    void shouldIndentBlocks() {
        JuniperConfig config = new JuniperConfig()
                .append("firewall {")
                .append("  family inet {")
                .append("filter x {")
                .append("}")
                .append("}")
                .append("}");

        assertThat(config.toString()).isEqualTo(String.join("\n",
                "firewall {",
                "    family inet {",
                "        filter x {",
                "        }",
                "    }",
                "}"));
    }

    @Test
    @DisplayName("Verbatim lines keep their own whitespace")
    void verbatimIsUntouched() {
        JuniperConfig config = new JuniperConfig(8)
                .append("term a {")
                .appendVerbatim("  raw line {")
                .append("}");

        assertThat(config.toString()).isEqualTo("        term a {\n  raw line {\n        }");
    }

    @Test
    @DisplayName("Closing a block that was never opened fails")
    void tooManyClosingBraces() {
        JuniperConfig config = new JuniperConfig(4).append("a {").append("}");

        assertThatThrownBy(() -> config.append("}"))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("Too many closing braces");
    }

    @Test
    @DisplayName("An open block fails serialization")
    void unbalancedBlocks() {
        JuniperConfig config = new JuniperConfig().append("firewall {");

        assertThatThrownBy(config::toString)
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("Unbalanced blocks");
    }
}
