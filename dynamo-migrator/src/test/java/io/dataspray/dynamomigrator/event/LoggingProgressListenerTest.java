// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator.event;

import com.google.common.collect.ImmutableList;
import com.google.common.eventbus.AllowConcurrentEvents;
import com.google.common.eventbus.Subscribe;
import org.junit.Test;

import java.lang.reflect.Method;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LoggingProgressListenerTest {

    @Test(timeout = 10_000L)
    public void testSubscribersAcceptConcurrentEvents() throws Exception {
        ImmutableList<Method> subscribers = Arrays.stream(LoggingProgressListener.class.getDeclaredMethods())
                .filter(method -> method.isAnnotationPresent(Subscribe.class))
                .collect(ImmutableList.toImmutableList());

        assertEquals(6, subscribers.size());
        for (Method subscriber : subscribers) {
            assertTrue(subscriber.getName(), subscriber.isAnnotationPresent(AllowConcurrentEvents.class));
        }
    }
}
