package personal.bistro.booking.reservation.adapter.out.persistence;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import personal.bistro.booking.reservation.domain.model.ReservationSearchCondition;

import java.util.ArrayList;
import java.util.List;

/**
 * 예약 목록 검색 조건을 JPA Criteria로 변환
 */
final class ReservationSpecifications {

    private ReservationSpecifications() {
    }

    static Specification<ReservationEntity> matching(ReservationSearchCondition condition) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (condition.status() != null) {
                predicates.add(cb.equal(root.get("status"), condition.status()));
            }
            if (condition.date() != null) {
                predicates.add(cb.equal(root.get("reservationDate"), condition.date()));
            }
            if (condition.email() != null) {
                predicates.add(cb.equal(cb.lower(root.get("email")), condition.email().toLowerCase()));
            }
            if (condition.seatingType() != null) {
                predicates.add(cb.equal(root.get("seatingType"), condition.seatingType()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
