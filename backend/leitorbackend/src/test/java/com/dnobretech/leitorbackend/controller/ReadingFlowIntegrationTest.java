package com.dnobretech.leitorbackend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ReadingFlowIntegrationTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper json;

    private String reader;
    private String stranger;
    private long readerId;

    @BeforeEach
    void setUp() throws Exception {
        // cada teste com usuarios proprios; o banco H2 e compartilhado pelo contexto
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        readerId = register("leitor-" + suffix);
        reader = login("leitor-" + suffix);
        register("outro-" + suffix);
        stranger = login("outro-" + suffix);
    }

    private long register(String username) throws Exception {
        String res = mvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json.writeValueAsString(Map.of(
                                "username", username, "password", "senha123",
                                "study_lang", "en", "display_lang", "en"))))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString(StandardCharsets.UTF_8);
        return json.readTree(res).at("/user/id").asLong();
    }

    private String login(String username) throws Exception {
        String res = mvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json.writeValueAsString(Map.of("username", username, "password", "senha123"))))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString(StandardCharsets.UTF_8);
        return json.readTree(res).get("token").asText();
    }

    private MockHttpServletRequestBuilder as(String token, MockHttpServletRequestBuilder req) {
        return req.header(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    }

    private JsonNode createArticle(String token, String title, String content, String lang, boolean isPrivate)
            throws Exception {
        Map<String, Object> body = new HashMap<>();
        body.put("title", title);
        body.put("content", content);
        body.put("language", lang);
        body.put("tags", List.of("teste"));
        body.put("is_private", isPrivate);
        String res = mvc.perform(as(token, post("/api/articles"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json.writeValueAsString(body)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString(StandardCharsets.UTF_8);
        return json.readTree(res).get("article");
    }

    @Test
    void createdArticleCarriesItsLexicalIndex() throws Exception {
        JsonNode article = createArticle(reader, "Hello", "Hello, world! Bye.", "en", false);

        List<String> words = json.convertValue(article.get("words"),
                json.getTypeFactory().constructCollectionType(List.class, String.class));
        assertThat(words).containsExactly("Hello", ",", " ", "world", "!", " ", "Bye", ".");
        // palavra -> true, como objeto JSON
        JsonNode unique = article.get("unique_words");
        assertThat(unique.isObject()).isTrue();
        assertThat(unique.fieldNames()).toIterable().containsExactly("bye", "hello", "world");
        unique.elements().forEachRemaining(v -> assertThat(v.isBoolean() && v.asBoolean()).isTrue());
        assertThat(article.get("sentences")).hasSize(2);
        assertThat(article.at("/sentences/1/start").asInt()).isEqualTo(6);
        // page-size 4 no perfil de teste
        assertThat(article.get("page_data")).hasSize(2);
        assertThat(article.get("content_length").asInt()).isEqualTo(18);
        assertThat(article.get("is_system").asBoolean()).isTrue();
        assertThat(article.get("uploader_id").asLong()).isEqualTo(readerId);

        mvc.perform(as(stranger, get("/api/articles/" + article.get("id").asLong())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.article.title").value("Hello"))
                .andExpect(jsonPath("$.article.unique_words.hello").value(true))
                .andExpect(jsonPath("$.article.unique_words.bye").value(true));
    }

    @Test
    void chineseArticleIsSegmentedLosslessly() throws Exception {
        String content = "我们学习中文。你好！";
        JsonNode article = createArticle(reader, "中文", content, "zh", true);

        StringBuilder joined = new StringBuilder();
        article.get("words").forEach(w -> joined.append(w.asText()));
        assertThat(joined.toString()).isEqualTo(content);
        assertThat(article.get("sentences")).hasSize(2);
        assertThat(article.get("is_system").asBoolean()).isFalse();
    }

    @Test
    void privateArticlesStayWithTheirUploader() throws Exception {
        JsonNode priv = createArticle(reader, "Diario " + readerId, "Dear diary.", "en", true);
        long id = priv.get("id").asLong();

        mvc.perform(as(stranger, get("/api/articles/" + id)))
                .andExpect(status().isNotFound());
        mvc.perform(as(reader, get("/api/articles/" + id)))
                .andExpect(status().isOk());

        mvc.perform(as(reader, get("/api/articles").param("search", "diario " + readerId)))
                .andExpect(jsonPath("$.count").value(0));
        mvc.perform(as(reader, get("/api/articles/user")))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.articles[0].id").value(id))
                .andExpect(jsonPath("$.articles[0].is_system").value(false))
                .andExpect(jsonPath("$.articles[0].words").doesNotExist());
        mvc.perform(as(stranger, get("/api/articles/user").param("user_id", String.valueOf(readerId))))
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    void publicListingFiltersBySearch() throws Exception {
        String marker = "Marcador" + readerId;
        createArticle(reader, marker + " um", "One.", "en", false);
        createArticle(reader, marker + " dois", "Two.", "en", false);

        mvc.perform(as(stranger, get("/api/articles").param("search", marker.toLowerCase())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.articles[0].title").value(marker + " dois"));
        mvc.perform(as(stranger, get("/api/articles").param("search", marker).param("limit", "1")))
                .andExpect(jsonPath("$.count").value(1));
    }

    @Test
    void emptyContentAndUnsupportedLanguageAreRejected() throws Exception {
        Map<String, Object> body = new HashMap<>();
        body.put("title", "vazio");
        body.put("content", "   ");
        body.put("language", "en");
        mvc.perform(as(reader, post("/api/articles"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json.writeValueAsString(body)))
                .andExpect(status().isBadRequest());

        body.put("content", "Bonjour.");
        body.put("language", "fr");
        mvc.perform(as(reader, post("/api/articles"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json.writeValueAsString(body)))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void vocabularyProgressIsPerUserAndCaseInsensitive() throws Exception {
        mvc.perform(as(reader, put("/api/words/status/batch"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json.writeValueAsString(Map.of(
                                "lang", "en", "words", List.of("Cat", "cat", "DOG"), "status", "learning"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
        mvc.perform(as(reader, put("/api/words/status"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json.writeValueAsString(Map.of("lang", "en", "word", "dog", "status", "KNOWN"))))
                .andExpect(status().isOk());
        mvc.perform(as(reader, put("/api/words/definition"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json.writeValueAsString(Map.of("lang", "en", "word", "Cat", "definition", "gato"))))
                .andExpect(status().isOk());

        mvc.perform(as(reader, get("/api/words/en")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.word_status_data.cat").value("learning"))
                .andExpect(jsonPath("$.data.word_status_data.dog").value("known"))
                .andExpect(jsonPath("$.data.word_definition_data.cat").value("gato"));

        mvc.perform(as(stranger, get("/api/words/en")))
                .andExpect(jsonPath("$.data.word_status_data").isEmpty());
        mvc.perform(as(reader, get("/api/words/zh")))
                .andExpect(jsonPath("$.data.word_status_data").isEmpty());
    }

    @Test
    void invalidWordStatusIsRejected() throws Exception {
        mvc.perform(as(reader, put("/api/words/status"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json.writeValueAsString(Map.of("lang", "en", "word", "cat", "status", "mastered"))))
                .andExpect(status().isBadRequest());
        mvc.perform(as(reader, get("/api/words/fr")))
                .andExpect(status().isBadRequest());
    }
}
