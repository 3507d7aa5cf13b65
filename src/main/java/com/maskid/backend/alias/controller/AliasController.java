package com.maskid.backend.alias.controller;

import com.maskid.backend.alias.dto.AliasCreateRequest;
import com.maskid.backend.alias.dto.AliasResponse;
import com.maskid.backend.alias.dto.AliasUpdateRequest;
import com.maskid.backend.alias.service.AliasService;
import com.maskid.backend.auth.security.AuthContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/aliases")
@RequiredArgsConstructor
public class AliasController {

    private final AliasService aliasService;
    private final AuthContext auth;

    @GetMapping
    public List<AliasResponse> list() {
        Long uid = auth.requireUserId();
        return aliasService.list(uid).stream().map(AliasResponse::from).toList();
    }

    @PostMapping
    public ResponseEntity<AliasResponse> create(@Valid @RequestBody(required = false) AliasCreateRequest body) {
        Long uid = auth.requireUserId();
        String prefix = (body == null) ? null : body.prefix();
        var created = aliasService.create(uid, prefix, Instant.now());
        return ResponseEntity.status(HttpStatus.CREATED).body(AliasResponse.from(created));
    }

    @PatchMapping("/{id}")
    public AliasResponse update(@PathVariable("id") Long id, @Valid @RequestBody AliasUpdateRequest body) {
        Long uid = auth.requireUserId();
        return AliasResponse.from(aliasService.setEnabled(uid, id, body.enabled()));
    }
}
