package com.tarterware.drillpath.configs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.tarterware.drillpath.models.ReferenceFrame;

@Configuration
@EnableConfigurationProperties(ReferenceFrameProperties.class)
public class ReferenceFrameConfig
{
    private static final Logger logger = LoggerFactory.getLogger(ReferenceFrameConfig.class);

    @Bean
    ReferenceFrame referenceFrame(ReferenceFrameProperties properties)
    {
        ReferenceFrame frame = properties.toReferenceFrame();
        logger.info("Reference frame: section at {} m, direction {} degrees, survey reference {}+{}",
                frame.getReferenceDistance(), frame.getDirectionAngle(), frame.getSurveyReference().getMajor(),
                frame.getSurveyReference().getMinor());
        return frame;
    }
}
