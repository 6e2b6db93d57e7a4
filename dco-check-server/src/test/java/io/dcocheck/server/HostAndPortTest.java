package io.dcocheck.server;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("HostAndPort Tests")
class HostAndPortTest {

	@Test
	@DisplayName("Should parse host and port")
	void shouldParse() {
		assertThat(HostAndPort.parse("localhost:9000")).isEqualTo(new HostAndPort("localhost", 9000));
		assertThat(HostAndPort.parse("0.0.0.0:0")).isEqualTo(new HostAndPort("0.0.0.0", 0));
		assertThat(HostAndPort.parse("[::1]:8080")).isEqualTo(new HostAndPort("::1", 8080));
	}

	@ParameterizedTest
	@ValueSource(strings = { "localhost", ":9000", "localhost:", "localhost:abc", "localhost:70000" })
	@DisplayName("Should reject malformed addresses")
	void shouldRejectMalformed(String address) {
		assertThatThrownBy(() -> HostAndPort.parse(address)).isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("invalid server address");
	}

}
