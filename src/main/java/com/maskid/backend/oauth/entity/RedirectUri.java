package com.maskid.backend.oauth.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/** client 登記過的合法 redirect uri */
@Getter
@Setter
@Entity
@Table(
        name = "redirect_uris",
        uniqueConstraints = @UniqueConstraint(name = "ux_redirect_uris_client_uri", columnNames = {"client_id", "uri"})
)
public class RedirectUri {

    public static final int MAX_LENGTH = 512;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "client_id", nullable = false)
    private Long clientId;

    // unique key 長度上限（utf8mb4 × 512 < 3072 bytes）
    @Column(name = "uri", nullable = false, length = RedirectUri.MAX_LENGTH)
    private String uri;
}
