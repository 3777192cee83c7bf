package personal.bistro.booking.reservation.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.bistro.booking.reservation.application.port.out.BlockedDateRepository;
import personal.bistro.booking.reservation.domain.exception.BlockedDateNotFoundException;
import personal.bistro.booking.reservation.domain.model.BlockedDate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("BlockedDateService 단위 테스트")
class BlockedDateServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T03:00:00Z"), ZoneId.of("Asia/Seoul"));
    private static final LocalDate DATE = LocalDate.of(2026, 12, 25);

    @Mock
    private BlockedDateRepository blockedDateRepository;
    @Mock
    private DailyAvailabilityCacheService dailyAvailabilityCacheService;

    private BlockedDateService blockedDateService;

    @BeforeEach
    void setUp() {
        blockedDateService = new BlockedDateService(blockedDateRepository, dailyAvailabilityCacheService, CLOCK);
    }

    @Test
    @DisplayName("날짜 차단 - 저장 후 해당 날짜 캐시 무효화")
    void block() {
        // given
        given(blockedDateRepository.save(any(BlockedDate.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        BlockedDate result = blockedDateService.block(DATE, "Christmas");

        // then
        assertThat(result.date()).isEqualTo(DATE);
        assertThat(result.reason()).isEqualTo("Christmas");
        assertThat(result.createdAt()).isEqualTo(LocalDateTime.of(2026, 10, 19, 12, 0));
        verify(dailyAvailabilityCacheService).evict(DATE);
    }

    @Test
    @DisplayName("차단 해제 - 삭제 후 캐시 무효화")
    void unblock() {
        // given
        given(blockedDateRepository.findByDate(DATE))
                .willReturn(Optional.of(BlockedDate.of(DATE, "Christmas", LocalDateTime.now(CLOCK))));

        // when
        blockedDateService.unblock(DATE);

        // then
        verify(blockedDateRepository).deleteByDate(DATE);
        verify(dailyAvailabilityCacheService).evict(DATE);
    }

    @Test
    @DisplayName("차단되지 않은 날짜 해제 시 BlockedDateNotFoundException")
    void unblock_NotBlocked() {
        // given
        given(blockedDateRepository.findByDate(DATE)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> blockedDateService.unblock(DATE))
                .isInstanceOf(BlockedDateNotFoundException.class)
                .hasMessage("Date is not blocked: date=2026-12-25");
        verify(blockedDateRepository, never()).deleteByDate(any());
        verify(dailyAvailabilityCacheService, never()).evict(any());
    }
}
