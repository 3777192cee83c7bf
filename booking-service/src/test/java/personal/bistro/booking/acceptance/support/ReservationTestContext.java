package personal.bistro.booking.acceptance.support;

import io.cucumber.spring.ScenarioScope;
import io.restassured.response.Response;
import lombok.Getter;
import lombok.Setter;
import org.springframework.stereotype.Component;

/**
 * Reservation Acceptance Test Context
 * 시나리오 간 상태 공유를 위한 컨텍스트 클래스
 *
 * @ScenarioScope: Cucumber 시나리오당 하나의 인스턴스 생성
 */
@Getter
@Setter
@Component
@ScenarioScope
public class ReservationTestContext {

    /** 마지막 HTTP API 응답 */
    private Response lastHttpResponse;

    /** 시나리오에서 마지막으로 생성한 예약 ID */
    private Long currentReservationId;

    /** 시나리오에서 마지막으로 등록한 대기 항목 ID */
    private Long currentWaitlistEntryId;
}
