package com.ryuqq.multistate.core.model;

import java.util.Map;

/**
 * State를 구성하는 원자 단위 요소.
 *
 * <p>Element는 행위를 갖지 않으며, 식별자와 타입 태그만으로 구분됩니다.
 * 동등성은 id로만 판단합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Element.of("btn-save", "Save Button", "button")</li>
 *   <li>Element.of("img-logo", "Logo") → type = "generic"</li>
 * </ul>
 *
 * @author MultiState Team
 * @since 1.0.0
 */
public final class Element {

    /**
     * 타입을 지정하지 않은 경우의 기본 타입.
     */
    public static final String DEFAULT_TYPE = "generic";

    private final String id;
    private final String name;
    private final String type;
    private final Map<String, Object> metadata;

    private Element(String id, String name, String type, Map<String, Object> metadata) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Element id cannot be null or blank");
        }
        if (name == null) {
            throw new IllegalArgumentException("Element name cannot be null");
        }
        this.id = id;
        this.name = name;
        this.type = (type == null || type.isBlank()) ? DEFAULT_TYPE : type;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Element 생성.
     *
     * @param id 식별자
     * @param name 이름
     * @param type 타입 태그 (null 또는 빈 문자열이면 "generic")
     * @param metadata 부가 정보 (null 허용)
     * @return Element 인스턴스
     * @throws IllegalArgumentException id가 null이거나 빈 문자열인 경우
     */
    public static Element of(String id, String name, String type, Map<String, Object> metadata) {
        return new Element(id, name, type, metadata);
    }

    /**
     * 메타데이터 없이 Element 생성.
     *
     * @param id 식별자
     * @param name 이름
     * @param type 타입 태그
     * @return Element 인스턴스
     */
    public static Element of(String id, String name, String type) {
        return new Element(id, name, type, null);
    }

    /**
     * 기본 타입으로 Element 생성.
     *
     * @param id 식별자
     * @param name 이름
     * @return Element 인스턴스
     */
    public static Element of(String id, String name) {
        return new Element(id, name, DEFAULT_TYPE, null);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Element element = (Element) o;
        return id.equals(element.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Element{id='" + id + "', name='" + name + "', type='" + type + "'}";
    }
}
