package com.maskid.backend.oauth.entity;

import com.maskid.backend.oauth.model.DisclosureChannel;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * (client, user) 的 consent binding：這個 client 看到的是哪個 alias 或真實 email。
 * 每組 (client, user) 最多一筆，建立後不再變動。
 */
@Getter
@Setter
@ToString
@Entity
@Table(
        name = "client_users",
        uniqueConstraints = @UniqueConstraint(name = "uq_client_user", columnNames = {"client_id", "user_id"})
)
public class ClientUser {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "client_id", nullable = false, updatable = false)
    private Long clientId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    // DB 欄位可為 NULL；對外一律透過 getChannel()
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @Column(name = "alias_id", updatable = false)
    private Long aliasId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static ClientUser of(Long clientId, Long userId, DisclosureChannel channel) {
        ClientUser cu = new ClientUser();
        cu.setClientId(clientId);
        cu.setUserId(userId);
        cu.setChannel(channel);
        return cu;
    }

    public DisclosureChannel getChannel() {
        return (aliasId == null) ? DisclosureChannel.realEmail() : DisclosureChannel.alias(aliasId);
    }

    public void setChannel(DisclosureChannel channel) {
        if (channel == null) throw new IllegalArgumentException("channel required");
        this.aliasId = (channel instanceof DisclosureChannel.Alias a) ? a.aliasId() : null;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
