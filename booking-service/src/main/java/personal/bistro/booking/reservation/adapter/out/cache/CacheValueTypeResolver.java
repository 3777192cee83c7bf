package personal.bistro.booking.reservation.adapter.out.cache;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.cfg.MapperConfig;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.impl.StdTypeResolverBuilder;

/**
 * 캐시 값 타입 정보 기록 규칙
 *
 * DailyAvailability, RestaurantSettings 같은 record는 final이지만 @class를 기록하고
 * 그 외에는 Object가 아닌 non-final 타입(List 등)에만 기록
 */
public class CacheValueTypeResolver extends StdTypeResolverBuilder {

    private final PolymorphicTypeValidator typeValidator;

    public CacheValueTypeResolver(PolymorphicTypeValidator typeValidator) {
        this.typeValidator = typeValidator;
        init(JsonTypeInfo.Id.CLASS, null);
        inclusion(JsonTypeInfo.As.PROPERTY);
    }

    @Override
    public PolymorphicTypeValidator subTypeValidator(MapperConfig<?> config) {
        return typeValidator;
    }

    public boolean useForType(JavaType type) {
        JavaType target = type;
        while (target.isArrayType() || target.isReferenceType()) {
            target = target.isArrayType() ? target.getContentType() : target.getReferencedType();
        }
        if (target.getRawClass().isRecord()) {
            return true;
        }
        return !target.isFinal() && !target.getRawClass().equals(Object.class);
    }
}
