package com.maskid.backend.oauth.controller;

import com.maskid.backend.auth.security.AuthContext;
import com.maskid.backend.oauth.dto.ClientCreateRequest;
import com.maskid.backend.oauth.dto.ClientCreatedResponse;
import com.maskid.backend.oauth.dto.ClientResponse;
import com.maskid.backend.oauth.dto.PublishRequest;
import com.maskid.backend.oauth.dto.RedirectUriRequest;
import com.maskid.backend.oauth.entity.Client;
import com.maskid.backend.oauth.service.ClientService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/clients")
@RequiredArgsConstructor
public class ClientController {

    private final ClientService clientService;
    private final AuthContext auth;

    @PostMapping
    public ResponseEntity<ClientCreatedResponse> create(@Valid @RequestBody ClientCreateRequest body) {
        Long uid = auth.requireUserId();
        Client c = clientService.create(uid, body.name(), body.homeUrl());
        return ResponseEntity.status(HttpStatus.CREATED).body(ClientCreatedResponse.from(c));
    }

    @GetMapping
    public List<ClientResponse> list() {
        Long uid = auth.requireUserId();
        return clientService.listOwned(uid).stream().map(this::toResponse).toList();
    }

    @GetMapping("/{id}")
    public ClientResponse detail(@PathVariable("id") Long id) {
        return toResponse(clientService.requireOwned(auth.requireUserId(), id));
    }

    @PostMapping("/{id}/redirect-uris")
    public ResponseEntity<ClientResponse> addRedirectUri(@PathVariable("id") Long id,
                                                         @Valid @RequestBody RedirectUriRequest body) {
        Long uid = auth.requireUserId();
        clientService.addRedirectUri(uid, id, body.uri());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(clientService.requireOwned(uid, id)));
    }

    @PatchMapping("/{id}/published")
    public ClientResponse publish(@PathVariable("id") Long id, @Valid @RequestBody PublishRequest body) {
        return toResponse(clientService.setPublished(auth.requireUserId(), id, body.published()));
    }

    @PostMapping(value = "/{id}/icon", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Map<String, String> uploadIcon(@PathVariable("id") Long id,
                                          @RequestPart("file") MultipartFile file) throws IOException {
        String url = clientService.uploadIcon(auth.requireUserId(), id, file);
        return Map.of("iconUrl", url);
    }

    private ClientResponse toResponse(Client c) {
        return new ClientResponse(
                c.getId(),
                c.getOauthClientId(),
                c.getName(),
                c.getHomeUrl(),
                c.isPublished(),
                clientService.nbUser(c),
                clientService.iconUrl(c),
                clientService.redirectUris(c.getId()),
                c.getCreatedAt()
        );
    }
}
