package org.autofetch.config;

import jakarta.xml.bind.annotation.XmlAttribute;
import jakarta.xml.bind.annotation.XmlElement;
import jakarta.xml.bind.annotation.XmlElementWrapper;
import jakarta.xml.bind.annotation.XmlRootElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw JAXB binding of autofetch.xml. Validated into {@link FetchConfig} by {@link ConfigLoader}.
 */
@XmlRootElement(name = "configuration")
public class XmlConfiguration {

    public String directory;
    public String timezone;
    public Integer idleSleepSeconds;
    public Worker worker;
    public Admin admin;

    @XmlElementWrapper(name = "jobs")
    @XmlElement(name = "job")
    public List<Job> jobs = new ArrayList<>();

    // --- Worker process launch ---
    @XmlRootElement(name = "worker")
    public static class Worker {
        public String javaCommand;
        public String jvmOptions;
    }

    // --- Undertow admin server ---
    @XmlRootElement(name = "admin")
    public static class Admin {
        public boolean enabled;
        public String host;
        public int port;
    }

    @XmlRootElement(name = "job")
    public static class Job {
        @XmlAttribute
        public String name;
        public String schedule;
        public String source;

        @XmlElement(name = "property")
        public List<Property> properties = new ArrayList<>();
    }

    @XmlRootElement(name = "property")
    public static class Property {
        @XmlAttribute
        public String name;
        @XmlAttribute
        public String value;
    }
}
