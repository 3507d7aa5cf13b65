package com.maskid.backend.oauth.service;

import com.maskid.backend.common.crypto.Digests;
import com.maskid.backend.common.storage.ObjectStorage;
import com.maskid.backend.idgen.IdentifierAllocator;
import com.maskid.backend.idgen.IdentifierGenerator;
import com.maskid.backend.idgen.IdentifierKind;
import com.maskid.backend.oauth.entity.Client;
import com.maskid.backend.oauth.entity.RedirectUri;
import com.maskid.backend.oauth.repo.ClientRepo;
import com.maskid.backend.oauth.repo.ClientUserRepo;
import com.maskid.backend.oauth.repo.RedirectUriRepo;
import com.maskid.backend.oauth.web.UnauthorizedClientException;
import com.maskid.backend.users.entity.StoredFile;
import com.maskid.backend.users.repo.StoredFileRepo;
import com.maskid.backend.users.service.UserService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

@Slf4j
@Service
public class ClientService {

    static final String DEFAULT_ICON = "/static/default-icon.svg";

    private final ClientRepo clients;
    private final RedirectUriRepo redirectUris;
    private final ClientUserRepo clientUsers;
    private final StoredFileRepo files;
    private final ObjectStorage storage;
    private final UserService userService;
    private final IdentifierAllocator allocator;
    private final IdentifierGenerator generator;
    private final String publicUrl;

    public ClientService(ClientRepo clients,
                         RedirectUriRepo redirectUris,
                         ClientUserRepo clientUsers,
                         StoredFileRepo files,
                         ObjectStorage storage,
                         UserService userService,
                         IdentifierAllocator allocator,
                         IdentifierGenerator generator,
                         @Value("${app.public-url:http://localhost:8080}") String publicUrl) {
        this.clients = clients;
        this.redirectUris = redirectUris;
        this.clientUsers = clientUsers;
        this.files = files;
        this.storage = storage;
        this.userService = userService;
        this.allocator = allocator;
        this.generator = generator;
        this.publicUrl = publicUrl.endsWith("/") ? publicUrl.substring(0, publicUrl.length() - 1) : publicUrl;
    }

    /** client_id = slug(name)-<10 碼隨機>；secret 40 碼。回傳的 entity 是唯一能看到 secret 的時機 */
    public Client create(Long ownerUserId, String name, String homeUrl) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("CLIENT_NAME_REQUIRED");
        Client created = allocator.allocate(IdentifierKind.CLIENT_ID, name, clientId -> {
            Client c = new Client();
            c.setOauthClientId(clientId);
            c.setOauthClientSecret(generator.generate(IdentifierKind.CLIENT_SECRET));
            c.setName(name.trim());
            c.setHomeUrl(homeUrl);
            c.setUserId(ownerUserId);
            Client saved = clients.saveAndFlush(c);
            // 同一個 transaction：標記失敗的話 client 也不留
            userService.markDeveloper(ownerUserId);
            return saved;
        });
        log.info("user {} created client {}", ownerUserId, created.getOauthClientId());
        return created;
    }

    @Transactional(readOnly = true)
    public List<Client> listOwned(Long ownerUserId) {
        return clients.findByUserIdOrderByIdDesc(ownerUserId);
    }

    @Transactional(readOnly = true)
    public Client requireOwned(Long ownerUserId, Long clientPk) {
        Client c = clients.findById(clientPk).orElseThrow(() -> new IllegalArgumentException("CLIENT_NOT_FOUND"));
        if (!c.getUserId().equals(ownerUserId)) throw new IllegalArgumentException("NOT_CLIENT_OWNER");
        return c;
    }

    @Transactional(readOnly = true)
    public Client requireById(Long clientPk) {
        return clients.findById(clientPk).orElseThrow(() -> new IllegalArgumentException("CLIENT_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public Client requireByOauthClientId(String oauthClientId) {
        if (oauthClientId == null || oauthClientId.isBlank()) {
            throw new UnauthorizedClientException("client_id is required");
        }
        return clients.findByOauthClientId(oauthClientId)
                .orElseThrow(() -> new UnauthorizedClientException("unknown client_id"));
    }

    /** client_id + secret；secret 以 constant-time 比較，任何錯誤都不透露是哪一個錯 */
    @Transactional(readOnly = true)
    public Client authenticate(String oauthClientId, String clientSecret) {
        Client c = clients.findByOauthClientId(oauthClientId == null ? "" : oauthClientId)
                .orElseThrow(() -> new UnauthorizedClientException("client authentication failed"));
        if (!Digests.constantTimeEquals(c.getOauthClientSecret(), clientSecret)) {
            log.warn("client {} presented a wrong secret", c.getOauthClientId());
            throw new UnauthorizedClientException("client authentication failed");
        }
        return c;
    }

    @Transactional
    public RedirectUri addRedirectUri(Long ownerUserId, Long clientPk, String uri) {
        Client c = requireOwned(ownerUserId, clientPk);
        String normalized = validateRedirectUri(uri);
        if (redirectUris.existsByClientIdAndUri(c.getId(), normalized)) {
            throw new IllegalArgumentException("REDIRECT_URI_ALREADY_REGISTERED");
        }
        RedirectUri r = new RedirectUri();
        r.setClientId(c.getId());
        r.setUri(normalized);
        return redirectUris.save(r);
    }

    @Transactional(readOnly = true)
    public List<String> redirectUris(Long clientPk) {
        return redirectUris.findByClientIdOrderByIdAsc(clientPk).stream().map(RedirectUri::getUri).toList();
    }

    /** 精確比對登記過的 uri */
    @Transactional(readOnly = true)
    public boolean isRedirectUriAllowed(Client client, String uri) {
        if (uri == null || uri.isBlank()) return false;
        return redirectUris.existsByClientIdAndUri(client.getId(), uri.trim());
    }

    @Transactional
    public Client setPublished(Long ownerUserId, Long clientPk, boolean published) {
        Client c = requireOwned(ownerUserId, clientPk);
        c.setPublished(published);
        return clients.save(c);
    }

    @Transactional
    public String uploadIcon(Long ownerUserId, Long clientPk, MultipartFile file) throws IOException {
        Client c = requireOwned(ownerUserId, clientPk);
        String path = userService.saveImage("client-icons/" + c.getId(), file);

        StoredFile f = new StoredFile();
        f.setPath(path);
        f = files.save(f);

        c.setIconId(f.getId());
        clients.save(c);
        return storage.resolveUrl(path);
    }

    @Transactional(readOnly = true)
    public long nbUser(Client client) {
        return clientUsers.countByClientId(client.getId());
    }

    @Transactional(readOnly = true)
    public String iconUrl(Client client) {
        if (client.getIconId() != null) {
            String url = files.findById(client.getIconId()).map(f -> storage.resolveUrl(f.getPath())).orElse(null);
            if (url != null) return url;
        }
        return publicUrl + DEFAULT_ICON;
    }

    static String validateRedirectUri(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("REDIRECT_URI_REQUIRED");
        String uri = raw.trim();
        if (uri.length() > RedirectUri.MAX_LENGTH) throw new IllegalArgumentException("REDIRECT_URI_TOO_LONG");
        try {
            URI u = new URI(uri);
            String scheme = (u.getScheme() == null) ? "" : u.getScheme().toLowerCase(Locale.ROOT);
            if (!u.isAbsolute() || u.getHost() == null) throw new IllegalArgumentException("REDIRECT_URI_INVALID");
            if (!scheme.equals("https") && !scheme.equals("http")) throw new IllegalArgumentException("REDIRECT_URI_INVALID");
            if (u.getFragment() != null) throw new IllegalArgumentException("REDIRECT_URI_INVALID");
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("REDIRECT_URI_INVALID");
        }
        return uri;
    }
}
