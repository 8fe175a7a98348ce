package com.dnobretech.leitorbackend.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "app_user",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_app_user_username", columnNames = {"username"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"password", "refreshToken"})
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String username;

    @Column(nullable = false)
    private String password;            // hash bcrypt

    @Column(nullable = false, updatable = false)
    private Instant createdOn;

    @Column(nullable = false, length = 8)
    private String studyLang;

    @Column(nullable = false, length = 8)
    private String displayLang;

    /** unico refresh token valido; um novo login sobrescreve */
    private String refreshToken;
}
