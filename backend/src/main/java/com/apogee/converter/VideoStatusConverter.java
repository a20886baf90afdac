package com.apogee.converter;

import com.apogee.entity.VideoStatus;
import jakarta.persistence.Converter;

/** Maps {@link VideoStatus} to the PostgreSQL video_status type. */
@Converter(autoApply = false)
public class VideoStatusConverter extends PostgreSQLEnumConverter<VideoStatus> {

    public VideoStatusConverter() {
        super(VideoStatus.class, "video_status");
    }
}
