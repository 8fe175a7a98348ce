package com.dnobretech.leitorbackend.controller;

import com.dnobretech.leitorbackend.auth.ClaimsUser;
import com.dnobretech.leitorbackend.dto.ArticleResponse;
import com.dnobretech.leitorbackend.dto.GetArticlesResponse;
import com.dnobretech.leitorbackend.dto.NewArticleRequest;
import com.dnobretech.leitorbackend.service.ArticleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/articles")
@RequiredArgsConstructor
public class ArticleController {

    private final ArticleService service;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ArticleResponse create(@RequestBody @Valid NewArticleRequest req, ClaimsUser caller) {
        return new ArticleResponse(service.create(req, caller));
    }

    @GetMapping
    public GetArticlesResponse list(@RequestParam(required = false) Integer limit,
                                    @RequestParam(required = false) Integer offset,
                                    @RequestParam(required = false) String lang,
                                    @RequestParam(required = false) String search) {
        return service.list(limit, offset, lang, search);
    }

    @GetMapping("/user")
    public GetArticlesResponse listByUser(@RequestParam(name = "user_id", required = false) Long userId,
                                          @RequestParam(required = false) Integer limit,
                                          @RequestParam(required = false) Integer offset,
                                          @RequestParam(required = false) String lang,
                                          @RequestParam(required = false) String search,
                                          ClaimsUser caller) {
        return service.listByUser(userId, limit, offset, lang, search, caller);
    }

    @GetMapping("/{id}")
    public ArticleResponse get(@PathVariable Long id, ClaimsUser caller) {
        return new ArticleResponse(service.getFull(id, caller));
    }
}
