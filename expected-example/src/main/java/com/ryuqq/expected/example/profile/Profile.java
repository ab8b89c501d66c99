package com.ryuqq.expected.example.profile;

import java.util.HashMap;
import java.util.Map;

/**
 * 사용자 프로필.
 *
 * @param firstName 이름
 * @param lastName 성
 *
 * @author Expected Team
 * @since 1.0.0
 */
public record Profile(String firstName, String lastName) {

    public static Profile fromMap(Map<String, Object> map) {
        return new Profile(stringOrNull(map.get("firstName")), stringOrNull(map.get("lastName")));
    }

    /**
     * 요청 본문으로 변환 (null 필드는 제외).
     *
     * @return 요청 본문
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        if (firstName != null) {
            map.put("firstName", firstName);
        }
        if (lastName != null) {
            map.put("lastName", lastName);
        }
        return map;
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
