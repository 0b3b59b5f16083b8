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

import java.io.IOException;
import java.time.LocalDate;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.github.totyumengr.querycubes.core.RecordTable.Row;

/**
 * Renders sample values of cubes: records through their label and dates as ISO-8601 strings such as 1959-08-17.
 * @author mengran
 *
 */
public class CubeJacksonModule extends SimpleModule {

    private static final long serialVersionUID = 1L;

    public CubeJacksonModule() {
        super("CubeJacksonModule");
        addSerializer(Row.class, new RowSerializer());
        addSerializer(LocalDate.class, new LocalDateSerializer());
    }

    private static class RowSerializer extends StdSerializer<Row> {

        private static final long serialVersionUID = 1L;

        RowSerializer() {
            super(Row.class);
        }

        @Override
        public void serialize(Row value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.toString());
        }
    }

    private static class LocalDateSerializer extends StdSerializer<LocalDate> {

        private static final long serialVersionUID = 1L;

        LocalDateSerializer() {
            super(LocalDate.class);
        }

        @Override
        public void serialize(LocalDate value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.toString());
        }
    }

}
