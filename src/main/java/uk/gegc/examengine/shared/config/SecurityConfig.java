package uk.gegc.examengine.shared.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import uk.gegc.examengine.shared.api.problem.ErrorTypes;
import uk.gegc.examengine.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.examengine.shared.security.GatewayAuthenticationFilter;

import java.io.IOException;
import java.net.URI;

@Configuration
@RequiredArgsConstructor
@EnableMethodSecurity
public class SecurityConfig {

    private final ObjectMapper objectMapper;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity httpSecurity) throws Exception {
        httpSecurity
                .csrf(AbstractHttpConfigurer::disable)
                .sessionManagement(sessionManagement -> sessionManagement.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers(HttpMethod.GET, "/v3/api-docs/**").permitAll()
                        .requestMatchers(HttpMethod.GET, "/swagger-ui/**", "/swagger-ui.html").permitAll()
                        .requestMatchers(HttpMethod.GET, "/actuator/health/**").permitAll()
                        .requestMatchers("/api/v1/admin/**").hasRole("ADMIN")
                        .anyRequest().authenticated())
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint((request, response, e) -> writeProblem(
                                request, response, HttpStatus.UNAUTHORIZED, ErrorTypes.UNAUTHORIZED,
                                "Unauthorized", "Authentication is required to access this resource"))
                        .accessDeniedHandler((request, response, e) -> writeProblem(
                                request, response, HttpStatus.FORBIDDEN, ErrorTypes.ACCESS_DENIED,
                                "Access Denied", "You do not have permission to access this resource")))
                .addFilterBefore(new GatewayAuthenticationFilter(), AnonymousAuthenticationFilter.class);

        return httpSecurity.build();
    }

    private void writeProblem(HttpServletRequest request, HttpServletResponse response, HttpStatus status,
                              URI type, String title, String detail) throws IOException {
        ProblemDetail problem = ProblemDetailBuilder.create(status, type, title, detail, request);
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
