package com.RxLedger.rx_backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

@Configuration
@EnableWebSecurity
@EnableMethodSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfig {

    public static final String PRESCRIPTION_AUTHORITY_PREFIX = "RX_";

    private static final Pattern LEDGER_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private final SecurityUsersConfig securityUsersConfig;

    private static final String[] PUBLIC_ENDPOINTS = {
            // Health check endpoints
            "/actuator/health",
            "/health",

            // Error pages
            "/error"
    };

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                .csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(PUBLIC_ENDPOINTS).permitAll()

                        // Prescription endpoints, role checks are per method
                        .requestMatchers("/api/prescriptions/**").authenticated()

                        // Ledger administration
                        .requestMatchers("/api/ledger/**").hasAnyRole("ADMIN", "PHARMACY")
                        .requestMatchers("/api/integrity-alerts/**").hasRole("ADMIN")

                        .anyRequest().authenticated())
                .httpBasic(Customizer.withDefaults());

        return http.build();
    }

    @Bean
    public UserDetailsService userDetailsService(PasswordEncoder passwordEncoder) {
        List<UserDetails> users = new ArrayList<>();
        for (SecurityUsersConfig.UserEntry entry : securityUsersConfig.getUsers()) {
            if (entry.getAddress() != null && !LEDGER_ADDRESS.matcher(entry.getAddress()).matches()) {
                throw new IllegalStateException("User " + entry.getUsername() + " has an invalid ledger address: "
                        + entry.getAddress());
            }
            List<SimpleGrantedAuthority> authorities = new ArrayList<>();
            authorities.add(new SimpleGrantedAuthority("ROLE_" + entry.getRole().name()));
            if (entry.getLinkedPrescriptionId() != null) {
                authorities.add(new SimpleGrantedAuthority(PRESCRIPTION_AUTHORITY_PREFIX + entry.getLinkedPrescriptionId()));
            }
            users.add(User.withUsername(entry.getUsername())
                    .password(passwordEncoder.encode(entry.getPassword()))
                    .authorities(authorities)
                    .build());
        }
        log.info("Loaded {} configured API users", users.size());
        return new InMemoryUserDetailsManager(users);
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration configuration = new CorsConfiguration();

        configuration.setAllowedOrigins(Arrays.asList(
                "http://localhost:3000",                // Local dev
                "http://localhost:5173"                 // Vite dev server
        ));

        configuration.setAllowedMethods(Arrays.asList(
                "GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS", "HEAD"
        ));

        configuration.setAllowedHeaders(Arrays.asList(
                "Authorization",
                "Content-Type",
                "X-Requested-With",
                "Accept",
                "Origin"
        ));

        configuration.setAllowCredentials(true);

        // Cache preflight response for 1 hour (3600 seconds)
        configuration.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return source;
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return PasswordEncoderFactories.createDelegatingPasswordEncoder();
    }
}
