package personal.bistro.booking.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import personal.bistro.booking.reservation.domain.model.ReservationStatus;
import personal.bistro.booking.reservation.domain.model.SeatingType;

/**
 * 쿼리 파라미터의 "no-show", "balcony" 같은 값을 enum으로 변환
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, SeatingType.class, SeatingType::from);
        registry.addConverter(String.class, ReservationStatus.class, ReservationStatus::from);
    }
}
