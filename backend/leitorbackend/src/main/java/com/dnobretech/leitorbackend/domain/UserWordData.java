package com.dnobretech.leitorbackend.domain;

import com.dnobretech.leitorbackend.enums.WordStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.HashMap;
import java.util.Map;

/**
 * Progresso de vocabulario por (usuario, idioma). Criado no primeiro write.
 * As chaves dos dois mapas ja estao em minusculas.
 */
@Entity
@Table(name = "user_word_data")
@IdClass(UserWordDataId.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserWordData {

    @Id
    private Long userId;

    @Id
    @Column(length = 8)
    private String lang;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private Map<String, WordStatus> wordStatusData = new HashMap<>();

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private Map<String, String> wordDefinitionData = new HashMap<>();
}
