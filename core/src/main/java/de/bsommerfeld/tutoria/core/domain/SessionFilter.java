package de.bsommerfeld.tutoria.core.domain;

import java.time.LocalDate;

/**
 * Criteria for session listings. All components are optional.
 *
 * <ul>
 * <li>{@code search}: case-insensitive match on the title or the course
 * name</li>
 * <li>{@code startDate}/{@code endDate}: whole days, inclusive</li>
 * <li>{@code limit}: maximum rows, {@code null} or non-positive for all</li>
 * <li>{@code excludeStudentId}: hides sessions that student is enrolled
 * in</li>
 * </ul>
 */
public record SessionFilter(
        String search,
        SessionLevel level,
        LocalDate startDate,
        LocalDate endDate,
        SessionStatus status,
        Integer limit,
        Long excludeStudentId) {

    public static SessionFilter all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String search;
        private SessionLevel level;
        private LocalDate startDate;
        private LocalDate endDate;
        private SessionStatus status;
        private Integer limit;
        private Long excludeStudentId;

        private Builder() {
        }

        public Builder search(String search) {
            this.search = search;
            return this;
        }

        public Builder level(SessionLevel level) {
            this.level = level;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder status(SessionStatus status) {
            this.status = status;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder excludeStudentId(Long excludeStudentId) {
            this.excludeStudentId = excludeStudentId;
            return this;
        }

        public SessionFilter build() {
            return new SessionFilter(search, level, startDate, endDate, status, limit, excludeStudentId);
        }
    }
}
