package com.touchline.mapper;

import com.touchline.domain.model.FireRecord;
import com.touchline.entity.FireRecordEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between FireRecord and FireRecordEntity. Field names match, so no
 * explicit mappings are needed.
 */
@Mapper
public interface FireRecordMapper {

    FireRecord toDomain(FireRecordEntity entity);

    FireRecordEntity toEntity(FireRecord domain);

    List<FireRecord> toDomainList(List<FireRecordEntity> entities);
}
