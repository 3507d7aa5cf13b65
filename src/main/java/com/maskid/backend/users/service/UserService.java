package com.maskid.backend.users.service;

import com.maskid.backend.alias.repo.AliasRepo;
import com.maskid.backend.billing.BillingProvider;
import com.maskid.backend.common.crypto.Digests;
import com.maskid.backend.common.storage.ObjectStorage;
import com.maskid.backend.plan.PlanEvaluator;
import com.maskid.backend.users.dto.MeResponse;
import com.maskid.backend.users.entity.StoredFile;
import com.maskid.backend.users.entity.User;
import com.maskid.backend.users.repo.StoredFileRepo;
import com.maskid.backend.users.repo.UserRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private static final String GRAVATAR = "https://www.gravatar.com/avatar/";
    private static final Set<String> PICTURE_EXTS = Set.of("png", "jpg", "jpeg", "gif", "webp");

    private final UserRepo users;
    private final StoredFileRepo files;
    private final AliasRepo aliases;
    private final ObjectStorage storage;
    private final PlanEvaluator planEvaluator;
    private final BillingProvider billing;

    @Transactional(readOnly = true)
    public User require(Long userId) {
        return users.findById(userId).orElseThrow(() -> new IllegalArgumentException("USER_NOT_FOUND"));
    }

    /** 有上傳頭像就回物件儲存 URL，否則 null（user info 的 avatar_url 用） */
    public String uploadedPictureUrl(User user) {
        if (user.getProfilePictureId() == null) return null;
        return files.findById(user.getProfilePictureId())
                .map(f -> storage.resolveUrl(f.getPath()))
                .orElse(null);
    }

    /** 頁面顯示用：沒有頭像就退回 gravatar */
    public String profilePictureUrl(User user) {
        String uploaded = uploadedPictureUrl(user);
        if (uploaded != null) return uploaded;
        return GRAVATAR + Digests.md5Hex(user.getEmail().trim().toLowerCase(Locale.ROOT));
    }

    /**
     * 只有 premium 且有 subscription id 時才有意義；沒有 id 屬於呼叫端錯誤，記 log 回 null。
     */
    public Instant planCurrentPeriodEnd(User user) {
        if (user.getStripeSubscriptionId() == null || user.getStripeSubscriptionId().isBlank()) {
            log.error("planCurrentPeriodEnd should not be called with empty subscription id, user={}", user.getId());
            return null;
        }
        try {
            return billing.fetchSubscriptionPeriodEnd(user.getStripeSubscriptionId()).orElse(null);
        } catch (Exception e) {
            // 顯示用資料，供應商掛掉不擋整頁
            log.warn("fetch subscription period end failed: user={}, err={}", user.getId(), e.toString());
            return null;
        }
    }

    @Transactional(readOnly = true)
    public MeResponse me(Long userId, Instant now) {
        User u = require(userId);
        long aliasCount = aliases.countByUserId(userId);
        Instant periodEnd = u.isPremium() && u.getStripeSubscriptionId() != null
                ? planCurrentPeriodEnd(u)
                : null;
        return new MeResponse(
                u.getId(),
                u.getEmail(),
                u.getName(),
                u.getPlan().name(),
                u.getPlanExpiration(),
                u.isPremium(),
                planEvaluator.shouldPromptUpgrade(u, now),
                planEvaluator.canCreateAlias(u, aliasCount, now),
                aliasCount,
                profilePictureUrl(u),
                periodEnd,
                u.isDeveloper()
        );
    }

    /** 第一次建立 client 時標記為開發者 */
    @Transactional
    public void markDeveloper(Long userId) {
        User u = require(userId);
        if (!u.isDeveloper()) {
            u.setDeveloper(true);
            users.save(u);
            log.info("user {} became a developer", userId);
        }
    }

    @Transactional
    public List<String> addPromoCode(Long userId, String promoCode) {
        User u = require(userId);
        if (u.getPromoCodeList().contains(promoCode.trim())) {
            throw new IllegalArgumentException("PROMO_CODE_ALREADY_USED");
        }
        u.saveNewPromoCode(promoCode);
        users.save(u);
        return u.getPromoCodeList();
    }

    @Transactional
    public String uploadProfilePicture(Long userId, MultipartFile file) throws IOException {
        User u = require(userId);
        String path = saveImage("avatars/" + userId, file);

        StoredFile f = new StoredFile();
        f.setPath(path);
        f = files.save(f);

        u.setProfilePictureId(f.getId());
        users.save(u);
        return storage.resolveUrl(path);
    }

    /** client icon 也共用這段 */
    public String saveImage(String folder, MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) throw new IllegalArgumentException("FILE_REQUIRED");
        String ext = extOf(file.getOriginalFilename());
        if (!PICTURE_EXTS.contains(ext)) throw new IllegalArgumentException("UNSUPPORTED_IMAGE_FORMAT");
        return storage.save(folder, file, ext);
    }

    private static String extOf(String filename) {
        if (filename == null) return "";
        int i = filename.lastIndexOf('.');
        return (i < 0) ? "" : filename.substring(i + 1).toLowerCase(Locale.ROOT);
    }
}
