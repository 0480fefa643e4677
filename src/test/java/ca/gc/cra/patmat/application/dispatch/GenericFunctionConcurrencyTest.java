package ca.gc.cra.patmat.application.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.patmat.domain.pattern.Patterns;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class GenericFunctionConcurrencyTest {

  @Test
  void concurrentRegistrationAndDispatchSeeConsistentSnapshots() throws Exception {
    GenericFunction<Integer, List<Integer>> f = GenericFunction.<Integer>builder("counter")
        .combiner(MethodCombiners.<Integer>all())
        .build();
    f.register(args -> 0, Patterns.type(Integer.class));

    ExecutorService executor = Executors.newFixedThreadPool(4);
    CountDownLatch start = new CountDownLatch(1);
    try {
      Future<?> writer = executor.submit(() -> {
        start.await();
        for (int i = 1; i <= 200; i++) {
          int id = i;
          f.register(args -> id, Patterns.all(Patterns.type(Integer.class)));
        }
        return null;
      });
      List<Future<Boolean>> readers = new ArrayList<>();
      for (int r = 0; r < 3; r++) {
        readers.add(executor.submit(() -> {
          start.await();
          for (int i = 0; i < 500; i++) {
            List<Integer> results = f.invoke(7);
            for (int j = 0; j < results.size(); j++) {
              if (results.get(j) != j) {
                return false;
              }
            }
          }
          return true;
        }));
      }
      start.countDown();
      writer.get(30, TimeUnit.SECONDS);
      for (Future<Boolean> reader : readers) {
        assertTrue(reader.get(30, TimeUnit.SECONDS));
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(201, f.methods().size());
  }
}
