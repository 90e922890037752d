package github.sarthakdev143.hdr_merge.service;

public interface ExposureStackFactory {

    ExposureStack create();
}
