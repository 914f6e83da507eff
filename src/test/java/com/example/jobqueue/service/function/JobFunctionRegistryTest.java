package com.example.jobqueue.service.function;

import com.example.jobqueue.exception.UnknownJobFunctionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JobFunctionRegistry Tests")
class JobFunctionRegistryTest {

    private JobFunctionRegistry registry;

    private final JobFunction sendReport = new JobFunction() {
        @Override
        public String getName() {
            return "send_report";
        }

        @Override
        public Object run(List<Object> args, Map<String, Object> kwargs) {
            return "sent";
        }
    };

    @BeforeEach
    void setUp() {
        registry = new JobFunctionRegistry(List.of(new EchoFunction(), sendReport));
        registry.initialize();
    }

    @Test
    @DisplayName("Should register and retrieve functions")
    void shouldRegisterAndRetrieveFunctions() {
        assertThat(registry.getFunction("send_report")).containsSame(sendReport);
        assertThat(registry.getFunction("echo")).isPresent();
    }

    @Test
    @DisplayName("Should return empty for an unregistered name")
    void shouldReturnEmptyForUnregisteredName() {
        assertThat(registry.getFunction("missing")).isEmpty();
        assertThat(registry.getFunction(null)).isEmpty();
    }

    @Test
    @DisplayName("Should throw for an unregistered name when using getFunctionOrThrow")
    void shouldThrowForUnregisteredName() {
        assertThatThrownBy(() -> registry.getFunctionOrThrow("missing"))
                .isInstanceOf(UnknownJobFunctionException.class)
                .hasMessageContaining("missing");
    }

    @Test
    @DisplayName("Should list registered names in order")
    void shouldListNames() {
        assertThat(registry.getRegisteredNames()).containsExactly("echo", "send_report");
        assertThat(registry.hasFunction("echo")).isTrue();
        assertThat(registry.hasFunction("sleep")).isFalse();
    }

    @Test
    @DisplayName("Should let a later registration override an earlier one")
    void shouldOverrideDuplicate() {
        // Given
        var replacement = new EchoFunction();

        // When
        registry.register(replacement);

        // Then
        assertThat(registry.getFunction("echo")).containsSame(replacement);
        assertThat(registry.getRegisteredNames()).hasSize(2);
    }
}
