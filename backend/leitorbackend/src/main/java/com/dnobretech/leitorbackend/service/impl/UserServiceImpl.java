package com.dnobretech.leitorbackend.service.impl;

import com.dnobretech.leitorbackend.domain.User;
import com.dnobretech.leitorbackend.dto.GetUsersResponse;
import com.dnobretech.leitorbackend.dto.RegisterRequest;
import com.dnobretech.leitorbackend.dto.SimpleUser;
import com.dnobretech.leitorbackend.dto.UpdateUserRequest;
import com.dnobretech.leitorbackend.repository.UserRepository;
import com.dnobretech.leitorbackend.service.UserService;
import com.dnobretech.leitorbackend.text.Language;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    static final int PAGE_SIZE = 50;

    private final UserRepository repo;
    private final JdbcTemplate jdbc;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Override
    @Transactional
    public SimpleUser register(RegisterRequest req) {
        String username = req.username().trim();
        String study = Language.fromCode(req.studyLang()).code();
        String display = Language.fromCode(req.displayLang()).code();

        if (repo.existsByUsername(username)) {
            throw new IllegalArgumentException("username já existente: " + username);
        }

        User u = User.builder()
                .username(username)
                .password(passwordEncoder.encode(req.password()))
                .createdOn(Instant.now(clock))
                .studyLang(study)
                .displayLang(display)
                .build();
        u = repo.save(u);
        log.info("[user] registrado id={} username={}", u.getId(), u.getUsername());
        return SimpleUser.from(u);
    }

    @Override
    @Transactional(readOnly = true)
    public GetUsersResponse list(Integer offset) {
        int off = (offset == null || offset < 0) ? 0 : offset;
        List<SimpleUser> users = jdbc.query(
                "SELECT id, username FROM app_user ORDER BY id LIMIT ? OFFSET ?",
                (rs, i) -> new SimpleUser(rs.getLong("id"), rs.getString("username")),
                PAGE_SIZE, off);
        return GetUsersResponse.of(users);
    }

    /** Tokens ja emitidos nao mudam; o refresh seguinte pega os dados novos. */
    @Override
    @Transactional
    public SimpleUser update(Long id, UpdateUserRequest req) {
        User u = repo.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("user id=" + id + " não encontrado"));

        if (req.username() != null) {
            String username = req.username().trim();
            if (username.isEmpty()) throw new IllegalArgumentException("username vazio");
            if (!username.equals(u.getUsername()) && repo.existsByUsername(username)) {
                throw new IllegalArgumentException("username já existente: " + username);
            }
            u.setUsername(username);
        }
        if (req.password() != null) u.setPassword(passwordEncoder.encode(req.password()));
        if (req.studyLang() != null) u.setStudyLang(Language.fromCode(req.studyLang()).code());
        if (req.displayLang() != null) u.setDisplayLang(Language.fromCode(req.displayLang()).code());

        u = repo.save(u);
        return SimpleUser.from(u);
    }
}
