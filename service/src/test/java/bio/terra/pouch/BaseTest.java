package bio.terra.pouch;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(classes = PouchApplication.class)
@ActiveProfiles({"test", "human-readable-logging"})
// tests that replace beans with @MockBean get their own context, don't keep them all around
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
public abstract class BaseTest {}
