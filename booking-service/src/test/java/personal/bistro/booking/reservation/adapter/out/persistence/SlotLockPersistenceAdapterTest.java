package personal.bistro.booking.reservation.adapter.out.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import personal.bistro.booking.reservation.domain.model.SeatingType;
import personal.bistro.booking.reservation.domain.model.SlotKey;

import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlotLockPersistenceAdapter 단위 테스트")
class SlotLockPersistenceAdapterTest {

    private static final SlotKey SLOT_KEY = SlotKey.of(LocalDate.of(2026, 10, 20), "19:00", SeatingType.BALCONY);

    @Mock
    private JpaSlotLockRepository jpaSlotLockRepository;

    private SlotLockPersistenceAdapter slotLockPersistenceAdapter;

    @BeforeEach
    void setUp() {
        slotLockPersistenceAdapter = new SlotLockPersistenceAdapter(jpaSlotLockRepository);
    }

    @Test
    @DisplayName("잠금 행이 있으면 새로 만들지 않는다")
    void acquire_ExistingRow() {
        // given
        given(jpaSlotLockRepository.findForUpdate("2026-10-20_19:00_balcony"))
                .willReturn(Optional.of(SlotLockEntity.open("2026-10-20_19:00_balcony")));

        // when
        slotLockPersistenceAdapter.acquire(SLOT_KEY);

        // then
        verify(jpaSlotLockRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("첫 예약이 잠금 행을 만들고 다시 잠근다")
    void acquire_CreatesRow() {
        // given
        given(jpaSlotLockRepository.findForUpdate("2026-10-20_19:00_balcony")).willReturn(Optional.empty());

        // when
        slotLockPersistenceAdapter.acquire(SLOT_KEY);

        // then
        verify(jpaSlotLockRepository).saveAndFlush(any(SlotLockEntity.class));
        verify(jpaSlotLockRepository, times(2)).findForUpdate("2026-10-20_19:00_balcony");
    }

    @Test
    @DisplayName("잠금 행 동시 생성으로 PK가 충돌하면 재시도 가능한 동시성 예외로 변환")
    void acquire_CreationRace() {
        // given
        given(jpaSlotLockRepository.findForUpdate("2026-10-20_19:00_balcony")).willReturn(Optional.empty());
        given(jpaSlotLockRepository.saveAndFlush(any(SlotLockEntity.class)))
                .willThrow(new DataIntegrityViolationException("Duplicate entry for key 'PRIMARY'"));

        // when & then
        assertThatThrownBy(() -> slotLockPersistenceAdapter.acquire(SLOT_KEY))
                .isInstanceOf(SlotLockCreationRaceException.class)
                .isInstanceOf(ConcurrencyFailureException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class)
                .hasMessageContaining("2026-10-20_19:00_balcony");
    }
}
