package dev.citadel.gateway.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Optional HTTP Basic authentication for the HTTP and WebSocket transports. With
 * {@code gateway.http.security.enabled=false} (the default) every request is permitted; the
 * Unix socket is protected by its file permissions instead.
 */
@Configuration
@EnableConfigurationProperties(HttpSecurityProperties.class)
public class SecurityConfig {

	@Bean
	public UserDetailsService userDetailsService(HttpSecurityProperties securityProperties) {
		UserDetails user = User.withUsername(securityProperties.username())
			.password("{noop}" + securityProperties.password())
			.roles("MCP_CLIENT")
			.build();
		return new InMemoryUserDetailsManager(user);
	}

	@Bean
	public SecurityFilterChain securityFilterChain(HttpSecurity http, HttpSecurityProperties securityProperties)
			throws Exception {
		http.csrf(AbstractHttpConfigurer::disable);
		http.sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS));
		if (securityProperties.enabled()) {
			http.authorizeHttpRequests(registry -> registry.anyRequest().authenticated());
			http.httpBasic(Customizer.withDefaults());
		}
		else {
			http.authorizeHttpRequests(registry -> registry.anyRequest().permitAll());
		}
		return http.build();
	}

}
