package com.ryuqq.transmap.application.item;

/**
 * 테스트 항목의 생성 대상 식별자 묶음.
 *
 * <p><strong>예시 (uid = {@code /rtems/task/req/construct}):</strong></p>
 * <ul>
 *   <li>ident: {@code RtemsTaskReqConstruct}</li>
 *   <li>contextType: {@code RtemsTaskReqConstruct_Context}</li>
 *   <li>instance: {@code RtemsTaskReqConstruct_Instance}</li>
 *   <li>runFunction: {@code RtemsTaskReqConstruct_Run}</li>
 *   <li>groupIdentifier: {@code TestCaseRtemsTaskReqConstruct}</li>
 * </ul>
 *
 * @param ident 항목 식별자 (camel case)
 * @param contextType 테스트 컨텍스트 타입 이름
 * @param instance 테스트 컨텍스트 인스턴스 이름
 * @param runFunction 실행 함수 이름
 * @param groupIdentifier 그룹 식별자
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record ItemContext(
    String ident,
    String contextType,
    String instance,
    String runFunction,
    String groupIdentifier
) {

    /**
     * uid와 종류로부터 컨텍스트 생성.
     *
     * @param kind 항목 종류
     * @param uid 항목 uid
     * @return ItemContext 인스턴스
     * @throws IllegalArgumentException uid가 식별자를 만들 수 없는 경우
     */
    public static ItemContext of(ItemKind kind, String uid) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        String ident = toCamelCase(uid);
        return new ItemContext(
            ident,
            ident + "_Context",
            ident + "_Instance",
            ident + "_Run",
            kind.groupPrefix() + ident
        );
    }

    /**
     * uid를 camel case 식별자로 변환.
     *
     * <p>선행 {@code /}를 제거하고 영숫자가 아닌 문자로 나눈 뒤 각 부분의 첫 글자를 대문자로 바꿉니다.</p>
     *
     * @param uid 항목 uid
     * @return camel case 식별자
     */
    static String toCamelCase(String uid) {
        if (uid == null || uid.isBlank()) {
            throw new IllegalArgumentException("uid cannot be null or blank");
        }
        StringBuilder sb = new StringBuilder();
        for (String part : uid.split("[^A-Za-z0-9]+")) {
            if (part.isEmpty()) {
                continue;
            }
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        if (sb.length() == 0) {
            throw new IllegalArgumentException("uid has no identifier characters: " + uid);
        }
        return sb.toString();
    }
}
