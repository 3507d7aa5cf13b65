package com.maskid.backend.oauth.service;

/** 授予 email scope 時，新 binding 要不要配 alias（app.consent.alias-mode） */
public enum AliasMode {
    /** 每個 user 都配 alias（受額度限制，額度不足退回真實 email） */
    ALWAYS,
    /** 只有 premium / trial 未到期的 user 配 alias */
    PREMIUM_ONLY,
    /** 一律真實 email */
    NEVER
}
