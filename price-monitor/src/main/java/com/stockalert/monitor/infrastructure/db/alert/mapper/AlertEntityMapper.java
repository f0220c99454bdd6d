package com.stockalert.monitor.infrastructure.db.alert.mapper;

import com.stockalert.monitor.domain.alert.Alert;
import com.stockalert.monitor.infrastructure.db.alert.AlertEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface AlertEntityMapper {

    Alert toDomain(AlertEntity entity);
}
