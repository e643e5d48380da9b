package com.community.portal.source;

import com.community.portal.exception.DataSourceException;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * 在线程池中提交数据拉取任务。
 * 返回的 future 被取消时会中断正在执行查询的工作线程，避免超时后的查询继续占用线程池。
 */
final class FetchTasks {

    private FetchTasks() {
    }

    static <T> CompletableFuture<T> submit(AsyncTaskExecutor executor, Callable<T> query) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> {
                try {
                    result.complete(query.call());
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (TaskRejectedException e) {
            result.completeExceptionally(new DataSourceException("数据拉取线程池已满", e));
            return result;
        }
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }
}
