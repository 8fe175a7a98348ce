package com.dnobretech.leitorbackend.domain;

import com.dnobretech.leitorbackend.text.TokenRange;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "article", indexes = {
        @Index(name = "ix_article_lang", columnList = "lang"),
        @Index(name = "ix_article_uploader", columnList = "uploader_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Article {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    private String author;                      // opcional

    @Column(nullable = false, columnDefinition = "text")
    private String content;

    @Column(nullable = false)
    private Integer contentLength;              // em code points

    /** tokens em ordem de documento, com repeticoes */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private List<String> words;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private List<TokenRange> sentences;

    /** palavra em minusculas -> true; presenca, nao frequencia */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private Map<String, Boolean> uniqueWords;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private List<TokenRange> pageData;

    @Column(nullable = false, updatable = false)
    private Instant createdOn;

    /** true = artigo do sistema (publico); false = privado do usuario */
    @JsonProperty("is_system")
    @Column(name = "is_system", nullable = false)
    private boolean system;

    @Column(nullable = false)
    private Long uploaderId;

    @Column(nullable = false, length = 8)
    private String lang;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private List<String> tags;
}
