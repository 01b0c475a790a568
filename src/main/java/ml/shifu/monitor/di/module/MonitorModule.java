/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.monitor.di.module;

import ml.shifu.monitor.container.obj.ModelProvider;
import ml.shifu.monitor.container.obj.MonitorConfig;

import com.google.common.base.Preconditions;
import com.google.inject.AbstractModule;

/**
 * Binds the model provider and monitor config every service depends on. Both are immutable for the lifetime of the
 * injector, services are created by their {@code @Inject} constructors.
 */
public class MonitorModule extends AbstractModule {

    private final ModelProvider modelProvider;

    private final MonitorConfig monitorConfig;

    public MonitorModule(ModelProvider modelProvider) {
        this(modelProvider, MonitorConfig.createDefault());
    }

    public MonitorModule(ModelProvider modelProvider, MonitorConfig monitorConfig) {
        Preconditions.checkNotNull(modelProvider, "modelProvider should not be null");
        Preconditions.checkNotNull(monitorConfig, "monitorConfig should not be null");
        this.modelProvider = modelProvider;
        this.monitorConfig = monitorConfig;
    }

    @Override
    protected void configure() {
        bind(ModelProvider.class).toInstance(modelProvider);
        bind(MonitorConfig.class).toInstance(monitorConfig);
    }

}
