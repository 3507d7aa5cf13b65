package com.maskid.backend.users.controller;

import com.maskid.backend.auth.security.AuthContext;
import com.maskid.backend.plan.PlanService;
import com.maskid.backend.users.dto.MeResponse;
import com.maskid.backend.users.dto.PromoCodeRequest;
import com.maskid.backend.users.service.UserService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/me")
public class UserController {

    private final UserService userService;
    private final PlanService planService;
    private final AuthContext auth;
    private final int trialDays;

    public UserController(UserService userService,
                          PlanService planService,
                          AuthContext auth,
                          @Value("${app.plan.trial-days:7}") int trialDays) {
        this.userService = userService;
        this.planService = planService;
        this.auth = auth;
        this.trialDays = trialDays;
    }

    @GetMapping
    public MeResponse me() {
        return userService.me(auth.requireUserId(), Instant.now());
    }

    /** 免費方案試用；已是 premium 會回 ALREADY_PREMIUM */
    @PostMapping("/trial")
    public MeResponse startTrial() {
        Long uid = auth.requireUserId();
        planService.startTrial(uid, trialDays, Instant.now());
        return userService.me(uid, Instant.now());
    }

    @PostMapping("/downgrade")
    public MeResponse downgrade() {
        Long uid = auth.requireUserId();
        planService.downgradeToFree(uid);
        return userService.me(uid, Instant.now());
    }

    @GetMapping("/promo-codes")
    public List<String> promoCodes() {
        return userService.require(auth.requireUserId()).getPromoCodeList();
    }

    @PostMapping("/promo-codes")
    public List<String> addPromoCode(@Valid @RequestBody PromoCodeRequest body) {
        return userService.addPromoCode(auth.requireUserId(), body.code());
    }

    @PostMapping(value = "/profile-picture", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Map<String, String> uploadPicture(@RequestPart("file") MultipartFile file) throws IOException {
        String url = userService.uploadProfilePicture(auth.requireUserId(), file);
        return Map.of("profilePictureUrl", url);
    }
}
