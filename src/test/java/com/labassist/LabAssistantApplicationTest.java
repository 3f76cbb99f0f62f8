package com.labassist;

import com.labassist.orchestration.PlanExecutor;
import com.labassist.orchestration.lifecycle.RequestWorker;
import com.labassist.orchestration.lifecycle.StaleRequestReaper;
import com.labassist.orchestration.synthesis.SynthesisEngine;
import com.labassist.orchestration.tools.DocumentSearchTool;
import com.labassist.orchestration.tools.MarkdownDocumentSearchTool;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots with the production configuration, only the datasource pointed at an embedded database.
 */
@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:contextload;DB_CLOSE_DELAY=-1;MODE=PostgreSQL",
        "spring.datasource.driver-class-name=org.h2.Driver",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
class LabAssistantApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertInstanceOf(MarkdownDocumentSearchTool.class, context.getBean(DocumentSearchTool.class));
        assertNotNull(context.getBean(PlanExecutor.class));
        assertNotNull(context.getBean(SynthesisEngine.class));
        assertNotNull(context.getBean(RequestWorker.class));
        assertTrue(context.getBeansOfType(StaleRequestReaper.class).isEmpty());
    }
}
