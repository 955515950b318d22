package com.everrich.reconciliation.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

/**
 * HTTP Basic security for the JSON API. Operators are declared under {@code app.security.users};
 * the authenticated name is the actor recorded in case history.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(authorize -> authorize
                .requestMatchers("/api/escalation/sweep", "/api/escalation/rules/**", "/api/cases/bulk-actions").hasRole("ADMIN")
                .anyRequest().authenticated()
            )
            .httpBasic(Customizer.withDefaults());
        return http.build();
    }

    @Bean
    @ConfigurationProperties(prefix = "app.security")
    public OperatorAccounts operatorAccounts() {
        return new OperatorAccounts();
    }

    @Bean
    public UserDetailsService userDetailsService(OperatorAccounts accounts, PasswordEncoder passwordEncoder) {
        List<UserDetails> users = accounts.getUsers().stream()
                .map(account -> User.withUsername(account.getUsername())
                        .password(passwordEncoder.encode(account.getPassword()))
                        .roles(account.getRoles().toArray(new String[0]))
                        .build())
                .toList();
        return new InMemoryUserDetailsManager(users);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    public static class OperatorAccounts {

        private List<Operator> users = List.of();

        public List<Operator> getUsers() {
            return users;
        }

        public void setUsers(List<Operator> users) {
            this.users = users;
        }
    }

    public static class Operator {

        private String username;
        private String password;
        private List<String> roles = List.of("OPERATOR");

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public List<String> getRoles() {
            return roles;
        }

        public void setRoles(List<String> roles) {
            this.roles = roles;
        }
    }
}
