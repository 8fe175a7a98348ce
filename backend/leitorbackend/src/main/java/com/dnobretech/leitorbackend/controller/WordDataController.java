package com.dnobretech.leitorbackend.controller;

import com.dnobretech.leitorbackend.auth.ClaimsUser;
import com.dnobretech.leitorbackend.dto.*;
import com.dnobretech.leitorbackend.service.WordDataService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/words")
@RequiredArgsConstructor
public class WordDataController {

    private final WordDataService service;

    @GetMapping("/{lang}")
    public GetWordDataResponse get(@PathVariable String lang, ClaimsUser caller) {
        return new GetWordDataResponse(service.get(caller.id(), lang));
    }

    @PutMapping("/status")
    public ResultResponse updateStatus(@RequestBody @Valid UpdateWordStatusRequest req, ClaimsUser caller) {
        service.updateStatus(caller.id(), req.lang(), req.word(), req.status());
        return ResultResponse.ok();
    }

    @PutMapping("/status/batch")
    public ResultResponse batchUpdateStatus(@RequestBody @Valid BatchUpdateWordStatusRequest req, ClaimsUser caller) {
        service.batchUpdateStatus(caller.id(), req.lang(), req.words(), req.status());
        return ResultResponse.ok();
    }

    @PutMapping("/definition")
    public ResultResponse updateDefinition(@RequestBody @Valid UpdateWordDefinitionRequest req, ClaimsUser caller) {
        service.updateDefinition(caller.id(), req.lang(), req.word(), req.definition());
        return ResultResponse.ok();
    }
}
