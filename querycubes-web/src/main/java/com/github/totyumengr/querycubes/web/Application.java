/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.querycubes.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ObjectUtils;

import com.fasterxml.jackson.databind.Module;

/**
 * Spring-Boot app entry point.
 * @author mengran
 *
 */
@Configuration
@EnableAutoConfiguration
@ComponentScan
public class Application {

    private static final Logger LOGGER = LoggerFactory.getLogger(Application.class);

    /**
     * Picked up by the auto-configured object mapper.
     */
    @Bean
    public Module cubeJacksonModule() {
        return new CubeJacksonModule();
    }

    public static void main(String[] args) {

        LOGGER.debug("Start application with args {}", ObjectUtils.getDisplayString(args));

        SpringApplication.run(Application.class, args);
    }
}
