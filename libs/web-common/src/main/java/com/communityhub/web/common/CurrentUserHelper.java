package com.communityhub.web.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.List;
import java.util.Optional;

/**
 * 当前用户信息提取工具类
 *
 * 社区平台签发的 token 把用户ID放在 userId（旧版为 id）里，
 * 标准 OIDC token 则只有 sub，这里统一按顺序兜底。
 *
 * 使用方式：
 * <pre>
 * {@code
 * @GetMapping("/example")
 * public ApiResponse<?> example(@AuthenticationPrincipal Jwt jwt) {
 *     String userId = CurrentUserHelper.getUserId(jwt);
 *     // ...
 * }
 * }
 * </pre>
 */
@Slf4j
public final class CurrentUserHelper {

    /** 用户ID claim 的查找顺序 */
    private static final List<String> USER_ID_CLAIMS = List.of("userId", "id");

    private CurrentUserHelper() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 从 JWT token 中提取当前用户信息
     *
     * @param jwt JWT token（从 @AuthenticationPrincipal 注入）
     * @return 当前用户信息，如果 jwt 为 null 则返回 null
     */
    public static CurrentUserInfo from(Jwt jwt) {
        if (jwt == null) {
            return null;
        }
        String userId = getUserId(jwt);
        String username = Optional.ofNullable(claimAsText(jwt, "username"))
                .or(() -> Optional.ofNullable(claimAsText(jwt, "preferred_username")))
                .orElse(null);
        return new CurrentUserInfo(userId, username, claimAsText(jwt, "role"));
    }

    /**
     * 快速获取用户ID：userId → id → sub
     */
    public static String getUserId(Jwt jwt) {
        if (jwt == null) {
            return null;
        }
        for (String claim : USER_ID_CLAIMS) {
            String value = claimAsText(jwt, claim);
            if (value != null) {
                return value;
            }
        }
        String sub = jwt.getSubject();
        return sub == null || sub.isBlank() ? null : sub;
    }

    private static String claimAsText(Jwt jwt, String claim) {
        try {
            Object value = jwt.getClaim(claim);
            if (value == null) {
                return null;
            }
            String text = value.toString().trim();
            return text.isEmpty() ? null : text;
        } catch (Exception e) {
            log.debug("读取 claim 失败: {}", claim, e);
            return null;
        }
    }
}
