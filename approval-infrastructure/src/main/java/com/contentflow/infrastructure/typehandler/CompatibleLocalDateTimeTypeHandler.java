package com.contentflow.infrastructure.typehandler;

import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedTypes;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * 审批时间字段映射。
 * <p>
 * 写入统一走 {@link Timestamp}；读取时带时区的值先换算到应用时区，再去掉偏移量，
 * 保证 submitted_at / approval_completed_at / published_at 与 Clock 产生的时间口径一致。
 * </p>
 */
@MappedTypes(LocalDateTime.class)
public class CompatibleLocalDateTimeTypeHandler extends BaseTypeHandler<LocalDateTime> {

    private final ZoneId zone;

    public CompatibleLocalDateTimeTypeHandler(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, LocalDateTime parameter, JdbcType jdbcType)
            throws SQLException {
        ps.setTimestamp(i, Timestamp.valueOf(parameter));
    }

    @Override
    public LocalDateTime getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return convert(rs.getObject(columnName), columnName);
    }

    @Override
    public LocalDateTime getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return convert(rs.getObject(columnIndex), "#" + columnIndex);
    }

    @Override
    public LocalDateTime getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return convert(cs.getObject(columnIndex), "#" + columnIndex);
    }

    LocalDateTime convert(Object raw, String column) throws SQLException {
        if (raw == null) {
            return null;
        }
        if (raw instanceof LocalDateTime value) {
            return value;
        }
        if (raw instanceof Timestamp value) {
            return value.toLocalDateTime();
        }
        if (raw instanceof OffsetDateTime value) {
            return value.atZoneSameInstant(zone).toLocalDateTime();
        }
        if (raw instanceof ZonedDateTime value) {
            return value.withZoneSameInstant(zone).toLocalDateTime();
        }
        if (raw instanceof Instant value) {
            return LocalDateTime.ofInstant(value, zone);
        }
        throw new SQLException("Column " + column + " holds unsupported time type: " + raw.getClass().getName());
    }
}
